package com.flamingo.ai.gedcom.service.validation;

import com.flamingo.ai.gedcom.config.IngestConfig;
import com.flamingo.ai.gedcom.exception.GedcomSourceException;
import com.flamingo.ai.gedcom.service.parsing.GedcomSourceReader;
import com.flamingo.ai.gedcom.service.parsing.LineClassifier;
import io.micrometer.core.annotation.Timed;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Read-only diagnostic pass over raw GEDCOM lines.
 *
 * <p>Reports every non-blank line that does not start with a level number followed by whitespace.
 * Independent of loading: it repairs nothing and never fails on bad content.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GedcomFormatValidator {

  private final LineClassifier lineClassifier;
  private final GedcomSourceReader sourceReader;
  private final IngestConfig ingestConfig;

  /** Validates with the configured line limit. */
  public ValidationReport validate(List<String> rawLines) {
    return validate(rawLines, ingestConfig.getValidation().getMaxLines());
  }

  /**
   * Validates at most {@code maxLines} lines.
   *
   * @param rawLines physical lines in document order
   * @param maxLines upper bound on the number of lines inspected
   * @return the report
   */
  @Timed(value = "gedcom.validate", description = "Time to validate a GEDCOM document")
  public ValidationReport validate(List<String> rawLines, int maxLines) {
    List<ValidationIssue> issues = new ArrayList<>();
    int checked = 0;

    for (String line : rawLines) {
      if (checked >= maxLines) {
        break;
      }
      checked++;
      if (line == null || line.isBlank()) {
        continue;
      }
      if (!lineClassifier.hasLevelPrefix(line)) {
        issues.add(
            new ValidationIssue(
                checked,
                ValidationIssue.INVALID_FORMAT,
                "Line does not start with level number",
                preview(line)));
      }
    }

    log.debug("Validated {} lines, {} issues", checked, issues.size());
    return ValidationReport.of(checked, issues);
  }

  /**
   * Reads and validates a stream. A read failure is reported as a {@code read_error} issue at line
   * 0 instead of being thrown.
   */
  public ValidationReport validate(InputStream inputStream, int maxLines) {
    List<String> lines;
    try {
      lines = sourceReader.readLines(inputStream);
    } catch (GedcomSourceException e) {
      log.warn("Validation could not read input: {}", e.getMessage());
      return ValidationReport.of(
          0,
          List.of(
              new ValidationIssue(
                  0, ValidationIssue.READ_ERROR, "Error reading file: " + e.getMessage(), "")));
    }
    return validate(lines, maxLines);
  }

  private String preview(String line) {
    int limit = ingestConfig.getValidation().getPreviewLength();
    return line.length() > limit ? line.substring(0, limit) + "..." : line;
  }
}
