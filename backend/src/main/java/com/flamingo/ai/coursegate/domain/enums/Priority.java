package com.flamingo.ai.coursegate.domain.enums;

/** Final priority of a reported finding, highest first. */
public enum Priority {
  CRITICAL,
  HIGH,
  MEDIUM,
  LOW,
  INFO;

  public boolean isAbove(Priority other) {
    return ordinal() < other.ordinal();
  }

  public boolean requiresImmediateAction() {
    return this == CRITICAL || this == HIGH;
  }

  /** Default priority for a finding that no severity rule matches. */
  public static Priority fromSeverity(Severity severity) {
    return severity == Severity.ERROR ? HIGH : MEDIUM;
  }
}
