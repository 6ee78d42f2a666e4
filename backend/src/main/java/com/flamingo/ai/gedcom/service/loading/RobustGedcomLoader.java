package com.flamingo.ai.gedcom.service.loading;

import com.flamingo.ai.gedcom.exception.GedcomLoadException;
import com.flamingo.ai.gedcom.service.parsing.GedcomSourceReader;
import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Loads GEDCOM input by escalating through progressively more permissive interpretations.
 *
 * <p>Stages run in {@link LoadStage} order: preprocess then build, build the raw input directly,
 * parse leniently. The first stage that produces a tree wins and no later stage runs. Each stage is
 * attempted at most once per call. Only when all of them fail does the caller see an error, a
 * {@link GedcomLoadException} carrying every stage's failure.
 */
@Service
@Slf4j
public class RobustGedcomLoader {

  private final List<LoadStrategy> strategies;
  private final GedcomSourceReader sourceReader;
  private final MeterRegistry meterRegistry;

  public RobustGedcomLoader(
      List<LoadStrategy> strategies,
      GedcomSourceReader sourceReader,
      MeterRegistry meterRegistry) {
    this.strategies =
        strategies.stream().sorted(Comparator.comparing(LoadStrategy::stage)).toList();
    this.sourceReader = sourceReader;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Reads and loads a GEDCOM stream. The caller keeps ownership of {@code inputStream}.
   *
   * @param inputStream raw GEDCOM bytes
   * @return the loaded tree and the stage that produced it
   * @throws GedcomLoadException if every stage failed
   */
  @Timed(value = "gedcom.load", description = "Time to load a GEDCOM document")
  public LoadResult load(InputStream inputStream) {
    return load(sourceReader.readLines(inputStream));
  }

  /**
   * Loads already-read lines.
   *
   * @param rawLines physical lines in document order
   * @return the loaded tree and the stage that produced it
   * @throws GedcomLoadException if every stage failed
   */
  @Timed(value = "gedcom.load", description = "Time to load a GEDCOM document")
  public LoadResult load(List<String> rawLines) {
    List<StageFailure> failures = new ArrayList<>();

    for (LoadStrategy strategy : strategies) {
      LoadStage stage = strategy.stage();
      log.debug("Attempting load stage {} on {} lines", stage, rawLines.size());
      RecordTree tree;
      try {
        tree = strategy.load(rawLines);
      } catch (RuntimeException e) {
        StageFailure failure = StageFailure.of(stage, e);
        failures.add(failure);
        recordStage(stage, "failure");
        log.warn("{} failed ({}), trying next stage", stage.getDisplayName(), e.getMessage());
        continue;
      }

      recordStage(stage, "success");
      log.info(
          "GEDCOM input loaded by stage {}: {} records, {} pointers",
          stage,
          tree.recordCount(),
          tree.index().size());
      Set<String> redeclared = tree.index().getRedeclaredPointers();
      if (!redeclared.isEmpty()) {
        log.warn("Pointers declared more than once, later declaration kept: {}", redeclared);
      }
      return new LoadResult(tree, stage, List.copyOf(failures));
    }

    meterRegistry.counter("gedcom.load.failed").increment();
    log.error("All {} load stages failed", failures.size());
    throw new GedcomLoadException(failures);
  }

  private void recordStage(LoadStage stage, String outcome) {
    meterRegistry
        .counter("gedcom.load.stage", "stage", stage.metricTag(), "outcome", outcome)
        .increment();
  }
}
