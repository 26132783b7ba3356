package com.gentoro.docgen.utility;

import java.util.Arrays;
import java.util.stream.Collectors;

public class StringUtility {

  public static boolean isBlank(String input) {
    return input == null || input.isBlank();
  }

  /** Trims {@code input}; returns {@code null} when nothing is left. */
  public static String trimToNull(String input) {
    if (input == null) return null;
    String trimmed = input.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  /** Drops lines that are empty or only whitespace, keeping line order and indentation. */
  public static String removeBlankLines(String input) {
    if (input == null) return null;
    return Arrays.stream(input.replaceAll("\\r\\n?", "\n").split("\n"))
        .filter(line -> !line.isBlank())
        .collect(Collectors.joining("\n"));
  }

  /** Trimmed text with blank lines removed, or {@code null} when blank. */
  public static String normalizeText(String input) {
    String trimmed = trimToNull(input);
    return trimmed == null ? null : removeBlankLines(trimmed);
  }
}
