package com.flamingo.ai.coursegate.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ClassificationException.class)
  public ResponseEntity<ApiError> handleClassification(
      ClassificationException ex, HttpServletRequest request) {

    incrementErrorCounter("classification_failed");
    String errorId = generateErrorId();
    log.error("Classification failed [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.CLASSIFICATION_FAILED,
        ex.getUserMessage(),
        null,
        request);
  }

  @ExceptionHandler(StateCorruptedException.class)
  public ResponseEntity<ApiError> handleStateCorrupted(
      StateCorruptedException ex, HttpServletRequest request) {

    incrementErrorCounter("state_corrupted");
    String errorId = generateErrorId();
    log.error("Corrupted state [{}] for run {}: {}", errorId, ex.getRunId(), ex.getMessage());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.STATE_CORRUPTED,
        "Stored state for run is corrupted; recover it from a checkpoint",
        null,
        request);
  }

  @ExceptionHandler(StateTransitionException.class)
  public ResponseEntity<ApiError> handleStateTransition(
      StateTransitionException ex, HttpServletRequest request) {

    incrementErrorCounter("state_transition");
    String errorId = generateErrorId();
    log.warn("Rejected transition [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.CONFLICT, errorId, ApiError.STATE_TRANSITION, ex.getMessage(), null, request);
  }

  @ExceptionHandler(StateStoreException.class)
  public ResponseEntity<ApiError> handleStateStore(
      StateStoreException ex, HttpServletRequest request) {

    incrementErrorCounter("state_unavailable");
    String errorId = generateErrorId();
    log.error("State store error [{}] for run {}: {}", errorId, ex.getRunId(), ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.STATE_UNAVAILABLE,
        ex.getUserMessage(),
        null,
        request);
  }

  @ExceptionHandler(CheckpointNotFoundException.class)
  public ResponseEntity<ApiError> handleCheckpointNotFound(
      CheckpointNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("checkpoint_not_found");
    String errorId = generateErrorId();
    log.warn("Checkpoint not found [{}]: {}/{}", errorId, ex.getRunId(), ex.getCheckpointName());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.CHECKPOINT_NOT_FOUND,
        "Checkpoint not found",
        null,
        request);
  }

  @ExceptionHandler(DuplicateCheckpointException.class)
  public ResponseEntity<ApiError> handleDuplicateCheckpoint(
      DuplicateCheckpointException ex, HttpServletRequest request) {

    incrementErrorCounter("checkpoint_exists");
    String errorId = generateErrorId();
    log.warn("Checkpoint exists [{}]: {}/{}", errorId, ex.getRunId(), ex.getCheckpointName());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.CHECKPOINT_EXISTS,
        "A checkpoint with this name already exists",
        null,
        request);
  }

  @ExceptionHandler(RecoveryException.class)
  public ResponseEntity<ApiError> handleRecovery(RecoveryException ex, HttpServletRequest request) {

    incrementErrorCounter("recovery_failed");
    String errorId = generateErrorId();
    log.error("Recovery rejected [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.RECOVERY_FAILED,
        "Checkpoint failed validation and was not restored",
        ex.getIssues(),
        request);
  }

  @ExceptionHandler(RunInProgressException.class)
  public ResponseEntity<ApiError> handleRunInProgress(
      RunInProgressException ex, HttpServletRequest request) {

    incrementErrorCounter("run_in_progress");
    String errorId = generateErrorId();
    log.warn("Run already executing [{}]: {}", errorId, ex.getRunId());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.RUN_IN_PROGRESS,
        "Run is already executing",
        null,
        request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_input");
    String errorId = generateErrorId();
    log.warn("Invalid input [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_INPUT, ex.getMessage(), null, request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    List<String> details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .toList();
    String message = details.isEmpty() ? "Validation failed" : details.get(0);

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_INPUT, message, details, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("malformed_request");
    String errorId = generateErrorId();
    log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.MALFORMED_REQUEST,
        "Request body could not be read",
        null,
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        null,
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      List<String> details,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .details(details)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
