package com.flamingo.ai.coursegate.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named bucket into which items are partitioned. Categories are defined entirely by
 * configuration; no rule refers to a concrete one.
 */
public record Category(
    String id,
    String label,
    int minimumPopulation,
    List<String> routingKeywords,
    Map<String, List<String>> focusKeywords,
    List<String> foundationKeywords) {

  public Category {
    routingKeywords = routingKeywords == null ? List.of() : List.copyOf(routingKeywords);
    focusKeywords =
        focusKeywords == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(focusKeywords));
    foundationKeywords = foundationKeywords == null ? List.of() : List.copyOf(foundationKeywords);
  }

  /** Keywords of the named focus, or an empty list when the category declares none. */
  public List<String> focus(String focusName) {
    return focusKeywords.getOrDefault(focusName, List.of());
  }
}
