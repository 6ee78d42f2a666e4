package com.flamingo.ai.gedcom.service.validation;

/**
 * One problem found by {@link GedcomFormatValidator}.
 *
 * @param line one-based line number, {@code 0} for problems not tied to a line
 * @param type machine-readable kind, e.g. {@code invalid_format}
 * @param description human-readable explanation
 * @param content offending content, truncated for display
 */
public record ValidationIssue(int line, String type, String description, String content) {

  public static final String INVALID_FORMAT = "invalid_format";
  public static final String READ_ERROR = "read_error";
}
