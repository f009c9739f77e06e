package com.flamingo.ai.coursegate.exception;

/** Exception thrown when a named checkpoint does not exist for a run. */
public class CheckpointNotFoundException extends RuntimeException {

  private final String runId;
  private final String checkpointName;

  public CheckpointNotFoundException(String runId, String checkpointName) {
    super("Checkpoint not found: " + runId + "/" + checkpointName);
    this.runId = runId;
    this.checkpointName = checkpointName;
  }

  public String getRunId() {
    return runId;
  }

  public String getCheckpointName() {
    return checkpointName;
  }
}
