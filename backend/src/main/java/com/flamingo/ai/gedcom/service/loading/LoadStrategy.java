package com.flamingo.ai.gedcom.service.loading;

import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;
import java.util.List;

/**
 * One interpretation of raw GEDCOM lines tried by {@link RobustGedcomLoader}.
 *
 * <p>Implementations are stateless Spring beans. A strategy signals that it cannot produce a tree
 * by throwing; the loader then moves on to the next stage.
 */
public interface LoadStrategy {

  /** The stage this strategy implements; determines its position in the escalation order. */
  LoadStage stage();

  /**
   * Builds a record tree from the raw input.
   *
   * @param rawLines physical lines as read from the source
   * @return the record tree
   * @throws RuntimeException if this interpretation cannot produce a tree
   */
  RecordTree load(List<String> rawLines);
}
