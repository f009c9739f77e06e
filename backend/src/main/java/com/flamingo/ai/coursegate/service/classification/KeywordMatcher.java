package com.flamingo.ai.coursegate.service.classification;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Whole-word, case-insensitive keyword matching used by the classification rules. */
public final class KeywordMatcher {

  // Configured category keywords only
  private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

  private KeywordMatcher() {}

  /** Total occurrences of all keywords in the text. */
  public static int hits(String text, List<String> keywords) {
    int total = 0;
    for (String keyword : keywords) {
      Matcher matcher = pattern(keyword).matcher(text);
      while (matcher.find()) {
        total++;
      }
    }
    return total;
  }

  /** Offset of the earliest keyword mention, or -1 when none occurs. */
  public static int firstIndex(String text, List<String> keywords) {
    int first = -1;
    for (String keyword : keywords) {
      Matcher matcher = pattern(keyword).matcher(text);
      if (matcher.find() && (first < 0 || matcher.start() < first)) {
        first = matcher.start();
      }
    }
    return first;
  }

  /**
   * Compiles a whole-word, case-insensitive pattern for the phrase without caching it. Use for
   * phrases taken from request text; only configured keywords go through the shared cache.
   */
  public static Pattern compile(String phrase) {
    return Pattern.compile(
        "(?<![\\p{L}\\p{N}])"
            + Pattern.quote(phrase.toLowerCase(Locale.ROOT).strip())
            + "(?![\\p{L}\\p{N}])",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }

  static int cachedPatternCount() {
    return PATTERNS.size();
  }

  private static Pattern pattern(String keyword) {
    return PATTERNS.computeIfAbsent(
        keyword.toLowerCase(Locale.ROOT).strip(), KeywordMatcher::compile);
  }
}
