package com.flamingo.ai.coursegate.exception;

/** Exception thrown when state store I/O fails after its retry is exhausted. */
public class StateStoreException extends RuntimeException {

  private final String runId;
  private final String userMessage;

  public StateStoreException(String runId, String message, Throwable cause) {
    super(message, cause);
    this.runId = runId;
    this.userMessage = "Pipeline state storage is temporarily unavailable. Please try again.";
  }

  public String getRunId() {
    return runId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
