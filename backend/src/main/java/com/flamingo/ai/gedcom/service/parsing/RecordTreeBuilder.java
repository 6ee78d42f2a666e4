package com.flamingo.ai.gedcom.service.parsing;

import com.flamingo.ai.gedcom.config.IngestConfig;
import com.flamingo.ai.gedcom.exception.StructuralFailureException;
import com.flamingo.ai.gedcom.service.parsing.model.AncestorStack;
import com.flamingo.ai.gedcom.service.parsing.model.ClassifiedLine;
import com.flamingo.ai.gedcom.service.parsing.model.LeveledLine;
import com.flamingo.ai.gedcom.service.parsing.model.OrphanLine;
import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds a {@link RecordTree} from lines that already satisfy the leveled grammar.
 *
 * <p>Strict: a non-blank line that does not tokenize aborts the build, as does a line more than one
 * level deeper than the record before it, and input without any record. The first record may sit
 * at depth 0 or at the configured fallback depth. Lines from {@link GedcomPreprocessor} always
 * pass.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordTreeBuilder {

  private final LineClassifier lineClassifier;
  private final IngestConfig ingestConfig;

  /**
   * Builds the record tree.
   *
   * @param lines leveled lines in document order; blank lines are ignored
   * @return the tree and its identifier index
   * @throws StructuralFailureException if a line is not a leveled line, jumps more than one level
   *     deeper than the previous record, or no record was found
   */
  public RecordTree build(List<String> lines) {
    AncestorStack stack = new AncestorStack();
    int lastDepth = ingestConfig.getPreprocessing().getFallbackDepth() - 1;
    int lineNumber = 0;

    for (String raw : lines) {
      lineNumber++;
      ClassifiedLine line = lineClassifier.classify(raw);
      if (line instanceof LeveledLine leveled) {
        if (leveled.depth() > lastDepth + 1) {
          throw new StructuralFailureException(
              lineNumber,
              "depth " + leveled.depth() + " is more than one level below depth " + lastDepth);
        }
        stack.attach(leveled);
        lastDepth = leveled.depth();
      } else if (line instanceof OrphanLine orphan) {
        throw new StructuralFailureException(
            lineNumber, "not a leveled line: " + abbreviate(orphan.text()));
      }
    }

    if (stack.attachedCount() == 0) {
      throw new StructuralFailureException("Input contains no records");
    }
    RecordTree tree = stack.finish();
    log.debug("Built record tree with {} records", stack.attachedCount());
    return tree;
  }

  private static String abbreviate(String text) {
    return text.length() > 40 ? text.substring(0, 40) + "..." : text;
  }
}
