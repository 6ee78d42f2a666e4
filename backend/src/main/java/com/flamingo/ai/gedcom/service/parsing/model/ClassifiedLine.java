package com.flamingo.ai.gedcom.service.parsing.model;

/**
 * The classification of one stripped physical line.
 *
 * <p>Produced by {@link com.flamingo.ai.gedcom.service.parsing.LineClassifier}; exactly one of
 * {@link LeveledLine}, {@link BlankLine} or {@link OrphanLine}.
 */
public sealed interface ClassifiedLine permits LeveledLine, BlankLine, OrphanLine {

  /** Returns the line as it should be written to normalized output. */
  String format();
}
