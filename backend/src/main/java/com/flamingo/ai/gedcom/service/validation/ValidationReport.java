package com.flamingo.ai.gedcom.service.validation;

import java.util.List;

/**
 * Result of a format validation pass.
 *
 * @param valid {@code true} if no issue was found
 * @param linesChecked number of lines inspected
 * @param issuesFound number of issues, same as {@code issues.size()}
 * @param issues the issues in line order
 */
public record ValidationReport(
    boolean valid, int linesChecked, int issuesFound, List<ValidationIssue> issues) {

  static ValidationReport of(int linesChecked, List<ValidationIssue> issues) {
    return new ValidationReport(issues.isEmpty(), linesChecked, issues.size(), List.copyOf(issues));
  }
}
