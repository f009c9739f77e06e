package com.flamingo.ai.coursegate.exception;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String CLASSIFICATION_FAILED = "CLASSIFY_001";
  public static final String STATE_CORRUPTED = "STATE_001";
  public static final String STATE_TRANSITION = "STATE_002";
  public static final String STATE_UNAVAILABLE = "STATE_003";
  public static final String CHECKPOINT_NOT_FOUND = "CHECKPOINT_001";
  public static final String CHECKPOINT_EXISTS = "CHECKPOINT_002";
  public static final String RECOVERY_FAILED = "CHECKPOINT_003";
  public static final String RUN_IN_PROGRESS = "RUN_001";
  public static final String INVALID_INPUT = "VALIDATION_001";
  public static final String MALFORMED_REQUEST = "VALIDATION_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Individual problems behind the error, when there are several. */
  private final List<String> details;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
