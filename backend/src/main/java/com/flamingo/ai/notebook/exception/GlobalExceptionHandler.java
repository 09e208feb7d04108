package com.flamingo.ai.notebook.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
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

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ApiError> handleNotFound(
      ResourceNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter(ex.getResourceType().toLowerCase() + "_not_found");
    String errorId = generateErrorId();
    log.warn("{} not found [{}]: {}", ex.getResourceType(), errorId, ex.getResourceId());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.NOT_FOUND)
                .message(ex.getResourceType() + " not found")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(InvalidStateException.class)
  public ResponseEntity<ApiError> handleInvalidState(
      InvalidStateException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_state");
    String errorId = generateErrorId();
    log.warn("Invalid state [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INVALID_STATE)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(ExtractionFailedException.class)
  public ResponseEntity<ApiError> handleExtractionFailed(
      ExtractionFailedException ex, HttpServletRequest request) {

    incrementErrorCounter("extraction_failed");
    String errorId = generateErrorId();
    log.error("Extraction failed [{}]: {}", errorId, ex.getReason());

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.EXTRACTION_FAILED)
                .message(ex.getReason())
                .retryable(ex.isTransient())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(UnknownTransformationException.class)
  public ResponseEntity<ApiError> handleUnknownTransformation(
      UnknownTransformationException ex, HttpServletRequest request) {

    incrementErrorCounter("unknown_transformation");
    String errorId = generateErrorId();
    log.warn("Unknown transformation [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.UNKNOWN_TRANSFORMATION)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(GenerationFailedException.class)
  public ResponseEntity<ApiError> handleGenerationFailed(
      GenerationFailedException ex, HttpServletRequest request) {

    incrementErrorCounter(ex.isTransient() ? "generation_transient" : "generation_permanent");
    String errorId = generateErrorId();
    log.error("Generation failed [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(
            ex.isTransient() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(
                    ex.isTransient()
                        ? ApiError.GENERATION_TRANSIENT
                        : ApiError.GENERATION_PERMANENT)
                .message(ex.getUserMessage())
                .retryable(ex.isTransient())
                .messageId(
                    ex.getUnansweredMessageId() != null
                        ? ex.getUnansweredMessageId().toString()
                        : null)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(OperationCancelledException.class)
  public ResponseEntity<ApiError> handleCancelled(
      OperationCancelledException ex, HttpServletRequest request) {

    incrementErrorCounter("operation_cancelled");
    String errorId = generateErrorId();
    log.info("Operation cancelled [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.OPERATION_CANCELLED)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");
    return validationError(message, request);
  }

  @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
    return validationError(ex.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private ResponseEntity<ApiError> validationError(String message, HttpServletRequest request) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Validation error [{}]: {}", errorId, message);

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
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
