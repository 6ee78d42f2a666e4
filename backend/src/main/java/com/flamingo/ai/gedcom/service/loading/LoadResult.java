package com.flamingo.ai.gedcom.service.loading;

import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;
import java.util.List;

/**
 * The outcome of a successful {@link RobustGedcomLoader#load} call.
 *
 * @param tree the parsed records
 * @param stage the stage that produced {@code tree}
 * @param earlierFailures failures of the stages tried before {@code stage}; empty when the first
 *     stage succeeded
 */
public record LoadResult(RecordTree tree, LoadStage stage, List<StageFailure> earlierFailures) {

  public boolean usedFallback() {
    return !earlierFailures.isEmpty();
  }
}
