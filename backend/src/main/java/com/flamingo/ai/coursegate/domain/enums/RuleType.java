package com.flamingo.ai.coursegate.domain.enums;

/** Identifier of the rule a violation was raised by. */
public enum RuleType {
  REQUIRED_FIELD(FindingCategory.STRUCTURAL),
  LINE_LIMIT(FindingCategory.STRUCTURAL),
  CHAR_LIMIT(FindingCategory.STRUCTURAL),
  WORD_MINIMUM(FindingCategory.CONTENT_RULE),
  WORD_MAXIMUM(FindingCategory.CONTENT_RULE),
  MARKER_MINIMUM(FindingCategory.CONTENT_RULE),
  QUOTA_MINIMUM(FindingCategory.DISTRIBUTIONAL),
  QUOTA_TARGET(FindingCategory.DISTRIBUTIONAL),
  QUOTA_SHARE(FindingCategory.DISTRIBUTIONAL),
  QUOTA_DIVERSITY(FindingCategory.DISTRIBUTIONAL),
  QUOTA_BAND_MISSING(FindingCategory.DISTRIBUTIONAL),
  CATEGORY_POPULATION(FindingCategory.DISTRIBUTIONAL);

  private final FindingCategory category;

  RuleType(FindingCategory category) {
    this.category = category;
  }

  public FindingCategory getCategory() {
    return category;
  }
}
