package com.flamingo.ai.coursegate.service.validation;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Measurements taken from field text. All counts are deterministic and locale-independent. */
public final class TextMetrics {

  private static final Pattern LINE_BREAK = Pattern.compile("\\R");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern MARKER = Pattern.compile("\\[[^\\]\\r\\n]*\\]");

  private TextMetrics() {}

  /** Lines with at least one non-whitespace character, trailing whitespace removed. */
  public static List<String> nonEmptyLines(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return Arrays.stream(LINE_BREAK.split(text))
        .map(String::stripTrailing)
        .filter(line -> !line.isBlank())
        .toList();
  }

  public static int charCount(String line) {
    return line.codePointCount(0, line.length());
  }

  /** Whitespace-separated words, not counting bracketed markers such as {@code [PAUSE]}. */
  public static int wordCount(String text) {
    if (text == null) {
      return 0;
    }
    String stripped = MARKER.matcher(text).replaceAll(" ").strip();
    return stripped.isEmpty() ? 0 : WHITESPACE.split(stripped).length;
  }

  /** Case-insensitive, non-overlapping occurrences of a literal token. */
  public static int occurrences(String text, String token) {
    if (text == null || token == null || token.isEmpty()) {
      return 0;
    }
    String haystack = text.toLowerCase(Locale.ROOT);
    String needle = token.toLowerCase(Locale.ROOT);
    int count = 0;
    int from = haystack.indexOf(needle);
    while (from >= 0) {
      count++;
      from = haystack.indexOf(needle, from + needle.length());
    }
    return count;
  }
}
