package com.gentoro.docgen;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.docgen.exception.ValidationException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  @DisplayName("Defaults apply when only the fragment is given")
  void defaults() {
    StartupParameters params = new StartupParameters(new String[] {"--fragment", "doc.xml"});

    assertEquals("doc.xml", params.fragmentFile());
    assertEquals(ConfigurationProvider.DEFAULT_LOCATION, params.configFile());
    assertFalse(params.isHelp());
    assertEquals(List.of(), params.assemblies());
    assertTrue(params.getOptionalParameter("output").isEmpty());
  }

  @Test
  void assembliesAreSplitOnCommas() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--fragment", "doc.xml", "--assemblies", "a.jar, b.jar,,classes/"});

    assertEquals(List.of("a.jar", "b.jar", "classes/"), params.assemblies());
  }

  @Test
  void flagWithoutValueIsPresentButEmpty() {
    StartupParameters params =
        new StartupParameters(new String[] {"--verbose", "--fragment", "doc.xml"});

    assertTrue(params.isParameterPresent("verbose"));
    assertTrue(params.getOptionalParameter("verbose").isEmpty());
  }

  @Test
  void helpModeNeedsNoFragment() {
    StartupParameters params = new StartupParameters(new String[] {"--mode", "help"});

    assertTrue(params.isHelp());
    assertTrue(StartupParameters.usage().contains("--fragment"));
  }

  @Test
  void missingFragmentIsRejected() {
    ValidationException ex =
        assertThrows(ValidationException.class, () -> new StartupParameters(new String[0]));
    assertEquals("Missing --fragment <path> argument", ex.getMessage());
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--mode", "serve", "--fragment", "doc.xml"}));
  }

  @Test
  void unknownFormatIsRejected() {
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--fragment", "doc.xml", "--format", "xml"}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--fragment", "doc.xml", "--format"}));
  }
}
