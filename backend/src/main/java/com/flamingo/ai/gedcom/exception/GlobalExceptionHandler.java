package com.flamingo.ai.gedcom.exception;

import com.flamingo.ai.gedcom.service.loading.StageFailure;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(GedcomLoadException.class)
  public ResponseEntity<ApiError> handleLoadFailure(
      GedcomLoadException ex, HttpServletRequest request) {

    incrementErrorCounter("gedcom_load_failed");
    String errorId = generateErrorId();
    log.warn("GEDCOM load failed [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.GEDCOM_LOAD_FAILED)
                .message(ex.getUserMessage())
                .details(ex.getFailures().stream().map(StageFailure::describe).toList())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(IndividualNotFoundException.class)
  public ResponseEntity<ApiError> handleIndividualNotFound(
      IndividualNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("individual_not_found");
    String errorId = generateErrorId();
    log.warn("Individual not found [{}]: {}", errorId, ex.getIndividualId());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INDIVIDUAL_NOT_FOUND)
                .message("Individual not found: " + ex.getIndividualId())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(GedcomSourceException.class)
  public ResponseEntity<ApiError> handleUnreadableSource(
      GedcomSourceException ex, HttpServletRequest request) {

    incrementErrorCounter("source_unreadable");
    String errorId = generateErrorId();
    log.error("Unreadable GEDCOM source [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.SOURCE_UNREADABLE)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiError> handleMissingInput(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Validation error [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
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

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
