package com.flamingo.ai.coursegate.domain.enums;

/** Broad class of a finding, used for severity lookup and reporting. */
public enum FindingCategory {
  /** Shape of the content: required fields, line and character limits. */
  STRUCTURAL,

  /** Rules about what the content says: word ranges, marker tokens. */
  CONTENT_RULE,

  /** Rules about how items are spread across a collection: quotas, category populations. */
  DISTRIBUTIONAL
}
