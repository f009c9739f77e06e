package com.flamingo.ai.coursegate.exception;

import com.flamingo.ai.coursegate.domain.enums.PipelineStatus;

/** Exception thrown when a write would move a run or section backwards in its lifecycle. */
public class StateTransitionException extends RuntimeException {

  private final String runId;
  private final PipelineStatus from;
  private final PipelineStatus to;

  public StateTransitionException(
      String runId, String subject, PipelineStatus from, PipelineStatus to) {
    super("Illegal transition of " + subject + " in run " + runId + ": " + from + " -> " + to);
    this.runId = runId;
    this.from = from;
    this.to = to;
  }

  public String getRunId() {
    return runId;
  }

  public PipelineStatus getFrom() {
    return from;
  }

  public PipelineStatus getTo() {
    return to;
  }
}
