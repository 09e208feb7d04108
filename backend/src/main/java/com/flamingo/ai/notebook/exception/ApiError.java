package com.flamingo.ai.notebook.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String NOT_FOUND = "NOT_FOUND_001";
  public static final String INVALID_STATE = "STATE_001";
  public static final String EXTRACTION_FAILED = "EXTRACTION_001";
  public static final String UNKNOWN_TRANSFORMATION = "TRANSFORMATION_001";
  public static final String GENERATION_TRANSIENT = "GENERATION_001";
  public static final String GENERATION_PERMANENT = "GENERATION_002";
  public static final String OPERATION_CANCELLED = "CANCELLED_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Whether repeating the same request may succeed. */
  private final Boolean retryable;

  /** User message left without a reply, for generation failures in chat. */
  private final String messageId;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
