package com.flamingo.ai.coursegate.exception;

import java.util.List;

/** Exception thrown when a checkpoint snapshot fails validation and cannot be recovered. */
public class RecoveryException extends RuntimeException {

  private final String runId;
  private final String checkpointName;
  private final List<String> issues;

  public RecoveryException(String runId, String checkpointName, List<String> issues) {
    super("Checkpoint " + runId + "/" + checkpointName + " is not recoverable: " + issues);
    this.runId = runId;
    this.checkpointName = checkpointName;
    this.issues = List.copyOf(issues);
  }

  public String getRunId() {
    return runId;
  }

  public String getCheckpointName() {
    return checkpointName;
  }

  public List<String> getIssues() {
    return issues;
  }
}
