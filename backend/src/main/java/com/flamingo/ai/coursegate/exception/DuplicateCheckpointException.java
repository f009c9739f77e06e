package com.flamingo.ai.coursegate.exception;

/** Exception thrown when a checkpoint name is already taken within a run. */
public class DuplicateCheckpointException extends RuntimeException {

  private final String runId;
  private final String checkpointName;

  public DuplicateCheckpointException(String runId, String checkpointName) {
    super("Checkpoint already exists: " + runId + "/" + checkpointName);
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
