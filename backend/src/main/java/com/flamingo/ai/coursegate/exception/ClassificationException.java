package com.flamingo.ai.coursegate.exception;

/** Exception thrown when the rule engine faults while classifying a batch. */
public class ClassificationException extends RuntimeException {

  private final String userMessage;

  public ClassificationException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Classification failed; no partial result was produced";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
