package com.flamingo.ai.gedcom.service.loading;

import com.flamingo.ai.gedcom.config.IngestConfig;
import com.flamingo.ai.gedcom.service.parsing.GedcomPreprocessor;
import com.flamingo.ai.gedcom.service.parsing.GedcomSourceReader;
import com.flamingo.ai.gedcom.service.parsing.RecordTreeBuilder;
import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * First stage: normalize the input with {@link GedcomPreprocessor}, then build strictly.
 *
 * <p>With spooling enabled the normalized text goes through a temporary file that is removed as
 * soon as the build finishes.
 */
@Component
@RequiredArgsConstructor
public class PreprocessAndBuildStrategy implements LoadStrategy {

  private final GedcomPreprocessor preprocessor;
  private final RecordTreeBuilder treeBuilder;
  private final GedcomSourceReader sourceReader;
  private final IngestConfig ingestConfig;

  @Override
  public LoadStage stage() {
    return LoadStage.PREPROCESS_AND_BUILD;
  }

  @Override
  public RecordTree load(List<String> rawLines) {
    List<String> normalized = preprocessor.preprocess(rawLines);
    if (!ingestConfig.getPreprocessing().isSpoolToDisk()) {
      return treeBuilder.build(normalized);
    }
    try (NormalizedTextSpool spool = NormalizedTextSpool.write(normalized)) {
      return treeBuilder.build(sourceReader.readLines(spool.path()));
    }
  }
}
