package com.flamingo.ai.gedcom.service.parsing;

import com.flamingo.ai.gedcom.config.IngestConfig;
import com.flamingo.ai.gedcom.exception.StructuralFailureException;
import com.flamingo.ai.gedcom.service.parsing.model.AncestorStack;
import com.flamingo.ai.gedcom.service.parsing.model.BlankLine;
import com.flamingo.ai.gedcom.service.parsing.model.ClassifiedLine;
import com.flamingo.ai.gedcom.service.parsing.model.LeveledLine;
import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Parser of last resort: tokenizes each raw line on its own and keeps whatever tokenizes.
 *
 * <p>Does not preprocess. Lines carrying embedded markup are rewritten to a neutral placeholder tag
 * before tokenizing; lines that still do not tokenize are skipped, and so is any line whose
 * attachment fails. Every line yields a {@link LineOutcome}, so the skip decisions can be
 * inspected. Completeness is traded for getting a tree at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LenientRecordParser {

  private static final Pattern DEPTH_AND_PAYLOAD = Pattern.compile("^(\\d+)\\s+(.*)$");
  private static final Pattern LEADING_POINTER = Pattern.compile("^(@[^@\\s][^@]*@)\\s+(.*)$");
  private static final Pattern MARKUP_TAG = Pattern.compile("<[^<>]*>");

  private final LineClassifier lineClassifier;
  private final IngestConfig ingestConfig;

  /** Result of a lenient pass: the tree and one outcome per input line. */
  public record LenientParseResult(RecordTree tree, List<LineOutcome> outcomes) {

    public long parsedCount() {
      return outcomes.stream().filter(LineOutcome::isParsed).count();
    }

    public List<LineOutcome> skipped() {
      return outcomes.stream()
          .filter(o -> !o.isParsed() && o.status() != LineOutcome.Status.SKIPPED_BLANK)
          .toList();
    }
  }

  /**
   * Parses leniently and fails only if nothing at all could be parsed.
   *
   * @param rawLines physical lines in document order
   * @return the record tree
   * @throws StructuralFailureException if no line produced a record
   */
  public RecordTree parseLenient(List<String> rawLines) {
    LenientParseResult result = parse(rawLines);
    if (result.parsedCount() == 0) {
      throw new StructuralFailureException(
          "No parseable lines among " + rawLines.size() + " input lines");
    }
    return result.tree();
  }

  /**
   * Parses every line independently and reports what happened to each. Never throws.
   *
   * @param rawLines physical lines in document order
   * @return the tree built from the parsed lines and the per-line outcomes
   */
  public LenientParseResult parse(List<String> rawLines) {
    AncestorStack stack = new AncestorStack();
    List<LineOutcome> outcomes = new ArrayList<>(rawLines.size());
    int lineNumber = 0;

    for (String raw : rawLines) {
      lineNumber++;
      LineOutcome outcome = parseLine(lineNumber, raw, stack);
      if (!outcome.isParsed() && outcome.status() != LineOutcome.Status.SKIPPED_BLANK) {
        log.debug("Skipping line {}: {}", lineNumber, outcome.detail());
      }
      outcomes.add(outcome);
    }

    LenientParseResult result = new LenientParseResult(stack.finish(), outcomes);
    log.info(
        "Lenient parse kept {} of {} lines, skipped {}",
        result.parsedCount(),
        rawLines.size(),
        result.skipped().size());
    return result;
  }

  private LineOutcome parseLine(int lineNumber, String raw, AncestorStack stack) {
    ClassifiedLine line = lineClassifier.classify(neutralizeMarkup(raw));
    if (line instanceof BlankLine) {
      return LineOutcome.skipped(lineNumber, LineOutcome.Status.SKIPPED_BLANK, null);
    }
    if (!(line instanceof LeveledLine leveled)) {
      return LineOutcome.skipped(
          lineNumber, LineOutcome.Status.SKIPPED_UNTOKENIZABLE, "line does not tokenize");
    }
    try {
      stack.attach(leveled);
      return LineOutcome.parsed(lineNumber);
    } catch (RuntimeException e) {
      return LineOutcome.skipped(lineNumber, LineOutcome.Status.SKIPPED_FAILED, e.getMessage());
    }
  }

  /**
   * Rewrites a line whose payload contains markup to {@code depth [pointer] PLACEHOLDER text}, the
   * text having its markup removed. Other lines are returned unchanged.
   */
  String neutralizeMarkup(String raw) {
    if (raw == null) {
      return null;
    }
    String line = raw.strip();
    Matcher m = DEPTH_AND_PAYLOAD.matcher(line);
    if (!m.matches() || !MARKUP_TAG.matcher(m.group(2)).find()) {
      return line;
    }
    String payload = m.group(2);
    String pointer = null;
    Matcher p = LEADING_POINTER.matcher(payload);
    if (p.matches()) {
      pointer = p.group(1);
      payload = p.group(2);
    }
    String text = MARKUP_TAG.matcher(payload).replaceAll(" ").replaceAll("\\s+", " ").strip();

    StringBuilder sb = new StringBuilder(m.group(1)).append(' ');
    if (pointer != null) {
      sb.append(pointer).append(' ');
    }
    sb.append(ingestConfig.getLenient().getPlaceholderTag());
    if (!text.isEmpty()) {
      sb.append(' ').append(text);
    }
    return sb.toString();
  }
}
