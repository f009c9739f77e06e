package com.flamingo.ai.coursegate.domain.enums;

/** Status of one step of a section. */
public enum StepStatus {
  PENDING,
  IN_PROGRESS,
  COMPLETED,
  FAILED
}
