package com.flamingo.ai.coursegate.service.gate;

import com.flamingo.ai.coursegate.service.report.ActionItem;
import java.util.List;

/**
 * What to do with a section after a gate evaluation.
 *
 * @param attempt 1-based number of the evaluation this decision follows
 * @param actionItems fixes to apply before retrying; empty unless the action is RETRY
 */
public record RevisionDecision(
    Action action, Reason reason, int attempt, List<ActionItem> actionItems) {

  public enum Action {
    ACCEPT,
    RETRY,
    ESCALATE
  }

  public enum Reason {
    PASSED,
    FAILED_RETRYABLE,
    MAX_ITERATIONS,
    NO_IMPROVEMENT
  }

  public RevisionDecision {
    actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
  }
}
