package com.flamingo.ai.coursegate.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle status of a run or of one of its sections. */
public enum PipelineStatus {
  /** Nothing has started yet. */
  PENDING,

  /** Work has started and not yet finished. */
  IN_PROGRESS,

  /** All work finished successfully. */
  COMPLETED,

  /** Work stopped on an unrecoverable error. */
  FAILED,

  /** Restored from a checkpoint; resumes by moving to {@link #IN_PROGRESS}. */
  RECOVERED;

  /**
   * Whether an ordinary write may move from this status to {@code next}. Moving into {@link
   * #RECOVERED} is reserved for checkpoint recovery and is never allowed here.
   */
  public boolean canTransitionTo(PipelineStatus next) {
    if (next == this) {
      return true;
    }
    return allowedNext().contains(next);
  }

  private Set<PipelineStatus> allowedNext() {
    return switch (this) {
      case PENDING -> EnumSet.of(IN_PROGRESS);
      case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED);
      case RECOVERED -> EnumSet.of(IN_PROGRESS);
      case COMPLETED, FAILED -> EnumSet.noneOf(PipelineStatus.class);
    };
  }
}
