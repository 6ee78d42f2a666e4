package com.flamingo.ai.gedcom.service.loading;

import com.flamingo.ai.gedcom.service.parsing.RecordTreeBuilder;
import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Second stage: build strictly from the unmodified input. */
@Component
@RequiredArgsConstructor
public class DirectBuildStrategy implements LoadStrategy {

  private final RecordTreeBuilder treeBuilder;

  @Override
  public LoadStage stage() {
    return LoadStage.DIRECT_BUILD;
  }

  @Override
  public RecordTree load(List<String> rawLines) {
    return treeBuilder.build(rawLines);
  }
}
