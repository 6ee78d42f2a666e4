package com.flamingo.ai.gedcom.service.loading;

/**
 * Why one load stage failed.
 *
 * @param stage the stage that failed
 * @param errorType simple class name of the failure
 * @param message failure message
 */
public record StageFailure(LoadStage stage, String errorType, String message) {

  static StageFailure of(LoadStage stage, Exception e) {
    return new StageFailure(stage, e.getClass().getSimpleName(), e.getMessage());
  }

  /** E.g. {@code "Direct parsing error: Line 3: not a leveled line: world"}. */
  public String describe() {
    return stage.getDisplayName() + " error: " + message;
  }
}
