package com.flamingo.ai.gedcom.exception;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String GEDCOM_LOAD_FAILED = "GEDCOM_001";
  public static final String INDIVIDUAL_NOT_FOUND = "GEDCOM_002";
  public static final String SOURCE_UNREADABLE = "GEDCOM_003";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Per-stage failure descriptions when loading failed. */
  private final List<String> details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
