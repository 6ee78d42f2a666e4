package com.flamingo.ai.gedcom.service.parsing;

import com.flamingo.ai.gedcom.config.IngestConfig;
import com.flamingo.ai.gedcom.service.parsing.model.ClassifiedLine;
import com.flamingo.ai.gedcom.service.parsing.model.LeveledLine;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Normalizes raw input into lines that all satisfy the leveled grammar.
 *
 * <p>Runs three passes: classify every line, clamp illegal depth jumps, fold orphan fragments into
 * continuation records. The result may be structurally approximate but every non-blank line is a
 * legal leveled line and no non-blank text is dropped. Running the preprocessor on its own output
 * returns that output unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GedcomPreprocessor {

  private final LineClassifier lineClassifier;
  private final DepthRepairEngine depthRepairEngine;
  private final ContinuationMerger continuationMerger;
  private final IngestConfig ingestConfig;

  /**
   * Normalizes the given lines. Never throws.
   *
   * @param rawLines physical lines in document order
   * @return normalized lines, blank lines preserved
   */
  public List<String> preprocess(List<String> rawLines) {
    List<ClassifiedLine> classified = new ArrayList<>(rawLines.size());
    // a document may open at depth 0 or at the fallback depth used for context-free orphans
    int lastDepth = ingestConfig.getPreprocessing().getFallbackDepth() - 1;
    int clamped = 0;

    for (String raw : rawLines) {
      ClassifiedLine line = lineClassifier.classify(raw);
      if (line instanceof LeveledLine leveled) {
        int repaired = depthRepairEngine.repair(leveled.depth(), lastDepth);
        if (repaired != leveled.depth()) {
          line = leveled.withDepth(repaired);
          clamped++;
        }
        lastDepth = repaired;
      }
      classified.add(line);
    }

    List<String> normalized =
        continuationMerger.merge(classified).stream().map(ClassifiedLine::format).toList();

    log.debug(
        "Preprocessed {} lines into {} lines ({} depth jumps clamped)",
        rawLines.size(),
        normalized.size(),
        clamped);
    return normalized;
  }
}
