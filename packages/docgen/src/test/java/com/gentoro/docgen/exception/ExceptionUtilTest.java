package com.gentoro.docgen.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void docGenExceptionKeepsCodeAndContext() {
    TypeNotFoundException ex = new TypeNotFoundException("acme.Order", List.of("a.jar", "b.jar"));

    ErrorDetails details = ExceptionUtil.toErrorDetails(ex);

    assertEquals("TypeNotFoundException", details.type());
    assertEquals(DocGenErrorCode.NOT_FOUND, details.code());
    assertEquals(
        "Type \"acme.Order\" could not be found. Ensure that it exists in one of the following"
            + " assemblies: a.jar, b.jar",
        details.message());
    assertEquals("acme.Order", details.context().get("type"));
    assertNotNull(details.timestamp());
  }

  @Test
  void otherThrowablesAreUnknown() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());

    assertEquals("IllegalStateException", details.type());
    assertEquals("", details.message());
    assertEquals(DocGenErrorCode.UNKNOWN, details.code());
    assertNull(details.context());
  }

  @Test
  void contextIsImmutableCopy() {
    Map<String, Object> input = new java.util.HashMap<>(Map.of("name", "a"));
    ValidationException ex = new ValidationException("bad", input);
    input.put("name", "b");

    assertEquals("a", ex.getContext().get("name"));
    assertThrows(UnsupportedOperationException.class, () -> ex.getContext().put("x", 1));
    assertTrue(ex.toString().startsWith("ValidationException{code=INVALID_ARGUMENT"));
  }
}
