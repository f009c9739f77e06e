package com.flamingo.ai.coursegate.domain.enums;

/** Outcome of a quota check or a quality gate evaluation. */
public enum Verdict {
  PASS,
  WARN,
  FAIL;

  public boolean isBlocking() {
    return this == FAIL;
  }

  /** Returns the worse of the two verdicts. */
  public Verdict worst(Verdict other) {
    return other.ordinal() > ordinal() ? other : this;
  }
}
