package com.flamingo.ai.gedcom.exception;

/**
 * Thrown when a build strategy cannot produce any tree from its input, e.g. because the input is
 * empty or a line violates the grammar the strategy requires. The robust loader treats it as a
 * signal to escalate to the next strategy.
 */
public class StructuralFailureException extends RuntimeException {

  private final int lineNumber;

  public StructuralFailureException(String message) {
    super(message);
    this.lineNumber = 0;
  }

  public StructuralFailureException(int lineNumber, String message) {
    super("Line " + lineNumber + ": " + message);
    this.lineNumber = lineNumber;
  }

  /** One-based line number of the offending line, or {@code 0} when not tied to a line. */
  public int getLineNumber() {
    return lineNumber;
  }
}
