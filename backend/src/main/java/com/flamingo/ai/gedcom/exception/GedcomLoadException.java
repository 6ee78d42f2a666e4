package com.flamingo.ai.gedcom.exception;

import com.flamingo.ai.gedcom.service.loading.StageFailure;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when every load strategy has failed. Carries one {@link StageFailure} per attempted stage
 * so callers can see which interpretation came closest.
 */
public class GedcomLoadException extends RuntimeException {

  private final List<StageFailure> failures;
  private final String userMessage;

  public GedcomLoadException(List<StageFailure> failures) {
    super(
        "Failed to parse GEDCOM input. "
            + failures.stream().map(StageFailure::describe).collect(Collectors.joining(". ")));
    this.failures = List.copyOf(failures);
    this.userMessage = "The GEDCOM file could not be parsed";
  }

  public List<StageFailure> getFailures() {
    return failures;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
