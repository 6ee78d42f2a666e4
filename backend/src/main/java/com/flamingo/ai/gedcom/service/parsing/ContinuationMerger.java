package com.flamingo.ai.gedcom.service.parsing;

import com.flamingo.ai.gedcom.config.IngestConfig;
import com.flamingo.ai.gedcom.service.parsing.model.BlankLine;
import com.flamingo.ai.gedcom.service.parsing.model.ClassifiedLine;
import com.flamingo.ai.gedcom.service.parsing.model.LeveledLine;
import com.flamingo.ai.gedcom.service.parsing.model.OrphanLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Folds orphan fragments into continuation records so that no text is lost.
 *
 * <ul>
 *   <li>The first orphan after a record at depth {@code d} becomes a synthetic continuation record
 *       at {@code d + 1}.
 *   <li>An orphan whose preceding non-blank line is already a continuation record is appended to it
 *       with a single space, unless the orphan or that record's value looks like a URI or markup,
 *       in which case it starts a new continuation record at the same depth.
 *   <li>An orphan with nothing before it is emitted at the configured fallback depth.
 * </ul>
 *
 * <p>The output contains only {@link LeveledLine} and {@link BlankLine} entries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContinuationMerger {

  private static final Set<String> CONTINUATION_TAGS = Set.of("CONT", "CONC");

  private final IngestConfig ingestConfig;

  /**
   * Merges orphans in an ordered line sequence.
   *
   * @param lines classified lines in document order
   * @return a new list in which every orphan has been folded into a continuation record
   */
  public List<ClassifiedLine> merge(List<ClassifiedLine> lines) {
    IngestConfig.Preprocessing cfg = ingestConfig.getPreprocessing();
    List<ClassifiedLine> out = new ArrayList<>(lines.size());
    int lastRecord = -1;
    int merged = 0;
    int synthesized = 0;

    for (ClassifiedLine line : lines) {
      if (line instanceof OrphanLine orphan) {
        String text = orphan.text();
        if (lastRecord < 0) {
          out.add(new LeveledLine(cfg.getFallbackDepth(), null, cfg.getContinuationTag(), text));
          lastRecord = out.size() - 1;
          synthesized++;
          continue;
        }
        LeveledLine previous = (LeveledLine) out.get(lastRecord);
        if (!isContinuation(previous)) {
          out.add(new LeveledLine(previous.depth() + 1, null, cfg.getContinuationTag(), text));
          lastRecord = out.size() - 1;
          synthesized++;
        } else if (isMergeable(text) && canExtend(previous)) {
          out.set(lastRecord, previous.appendValue(text));
          merged++;
        } else {
          out.add(new LeveledLine(previous.depth(), null, cfg.getContinuationTag(), text));
          lastRecord = out.size() - 1;
          synthesized++;
        }
      } else {
        out.add(line);
        if (line instanceof LeveledLine) {
          lastRecord = out.size() - 1;
        }
      }
    }

    if (synthesized > 0 || merged > 0) {
      log.debug(
          "Folded orphan fragments: {} continuation records created, {} merged",
          synthesized,
          merged);
    }
    return out;
  }

  /** Returns {@code true} if the record's tag marks it as continuation text. */
  public boolean isContinuation(LeveledLine line) {
    return CONTINUATION_TAGS.contains(line.tag())
        || line.tag().equals(ingestConfig.getPreprocessing().getContinuationTag());
  }

  private boolean canExtend(LeveledLine continuation) {
    return continuation.value() == null || isMergeable(continuation.value());
  }

  /**
   * Returns {@code true} if {@code text} may share a line with other continuation text. URIs and
   * markup are kept on their own line.
   */
  boolean isMergeable(String text) {
    IngestConfig.Preprocessing cfg = ingestConfig.getPreprocessing();
    if (!text.isEmpty() && text.charAt(0) == cfg.getMarkupOpenChar()) {
      return false;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    return cfg.getUriPrefixes().stream()
        .noneMatch(prefix -> lower.startsWith(prefix.toLowerCase(Locale.ROOT)));
  }
}
