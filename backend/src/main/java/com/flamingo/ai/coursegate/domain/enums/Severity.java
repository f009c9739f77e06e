package com.flamingo.ai.coursegate.domain.enums;

/** Severity of a single validation finding. */
public enum Severity {
  /** Blocks acceptance of the content unit. */
  ERROR,

  /** Advisory; only blocks if it drags a weighted score below threshold. */
  WARNING
}
