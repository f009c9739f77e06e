package com.flamingo.ai.coursegate.exception;

/** Exception thrown when sections are submitted for a run that is already executing. */
public class RunInProgressException extends RuntimeException {

  private final String runId;

  public RunInProgressException(String runId) {
    super("Run is already executing: " + runId);
    this.runId = runId;
  }

  public String getRunId() {
    return runId;
  }
}
