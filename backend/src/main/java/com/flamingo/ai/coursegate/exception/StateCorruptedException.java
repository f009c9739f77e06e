package com.flamingo.ai.coursegate.exception;

/** Exception thrown when a persisted state or checkpoint cannot be parsed or is schema-invalid. */
public class StateCorruptedException extends RuntimeException {

  private final String runId;

  public StateCorruptedException(String runId, String message) {
    super(message);
    this.runId = runId;
  }

  public StateCorruptedException(String runId, String message, Throwable cause) {
    super(message, cause);
    this.runId = runId;
  }

  public String getRunId() {
    return runId;
  }
}
