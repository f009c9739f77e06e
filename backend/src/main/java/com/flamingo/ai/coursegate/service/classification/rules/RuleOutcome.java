package com.flamingo.ai.coursegate.service.classification.rules;

import java.util.List;

/**
 * What a single rule concluded about an item.
 *
 * <p>A decisive outcome names exactly one category. A contested outcome names the categories
 * the rule supported without being able to choose between them, in catalog order.
 */
public record RuleOutcome(Kind kind, List<String> categories) {

  public enum Kind {
    DECISIVE,
    CONTESTED,
    ABSTAIN
  }

  private static final RuleOutcome ABSTAIN = new RuleOutcome(Kind.ABSTAIN, List.of());

  public RuleOutcome {
    categories = List.copyOf(categories);
  }

  public static RuleOutcome decisive(String categoryId) {
    return new RuleOutcome(Kind.DECISIVE, List.of(categoryId));
  }

  /** A contest of one category is decisive; a contest of none is an abstention. */
  public static RuleOutcome contested(List<String> categoryIds) {
    if (categoryIds.isEmpty()) {
      return ABSTAIN;
    }
    if (categoryIds.size() == 1) {
      return decisive(categoryIds.get(0));
    }
    return new RuleOutcome(Kind.CONTESTED, categoryIds);
  }

  public static RuleOutcome abstain() {
    return ABSTAIN;
  }

  public boolean isDecisive() {
    return kind == Kind.DECISIVE;
  }

  public String winner() {
    if (!isDecisive()) {
      throw new IllegalStateException("Outcome is not decisive: " + kind);
    }
    return categories.get(0);
  }
}
