package com.flamingo.ai.gedcom.service.parsing;

/**
 * What the lenient parser did with one physical line.
 *
 * @param lineNumber one-based line number
 * @param status whether the line became a record or why it was skipped
 * @param detail human-readable reason for a skip; {@code null} for parsed lines
 */
public record LineOutcome(int lineNumber, Status status, String detail) {

  public enum Status {
    PARSED,
    SKIPPED_BLANK,
    SKIPPED_UNTOKENIZABLE,
    SKIPPED_FAILED
  }

  static LineOutcome parsed(int lineNumber) {
    return new LineOutcome(lineNumber, Status.PARSED, null);
  }

  static LineOutcome skipped(int lineNumber, Status status, String detail) {
    return new LineOutcome(lineNumber, status, detail);
  }

  public boolean isParsed() {
    return status == Status.PARSED;
  }
}
