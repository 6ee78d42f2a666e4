package com.flamingo.ai.gedcom.api.dto.response;

import com.flamingo.ai.gedcom.service.genealogy.TreeStatistics;
import com.flamingo.ai.gedcom.service.loading.LoadResult;
import com.flamingo.ai.gedcom.service.loading.LoadStage;
import com.flamingo.ai.gedcom.service.loading.StageFailure;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO summarising a successful load. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseSummaryResponse {

  private LoadStage stage;
  private int recordCount;
  private int individualCount;
  private int familyCount;
  private List<String> redeclaredPointers;
  private List<String> fallbackFailures;

  /** Creates a summary from a load result and its statistics. */
  public static ParseSummaryResponse from(LoadResult result, TreeStatistics statistics) {
    return ParseSummaryResponse.builder()
        .stage(result.stage())
        .recordCount(statistics.recordCount())
        .individualCount(statistics.individualCount())
        .familyCount(statistics.familyCount())
        .redeclaredPointers(List.copyOf(result.tree().index().getRedeclaredPointers()))
        .fallbackFailures(result.earlierFailures().stream().map(StageFailure::describe).toList())
        .build();
  }
}
