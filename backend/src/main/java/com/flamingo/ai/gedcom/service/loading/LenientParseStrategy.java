package com.flamingo.ai.gedcom.service.loading;

import com.flamingo.ai.gedcom.service.parsing.LenientRecordParser;
import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Last stage: keep every line that tokenizes on its own and skip the rest. */
@Component
@RequiredArgsConstructor
public class LenientParseStrategy implements LoadStrategy {

  private final LenientRecordParser lenientParser;

  @Override
  public LoadStage stage() {
    return LoadStage.LENIENT_PARSE;
  }

  @Override
  public RecordTree load(List<String> rawLines) {
    return lenientParser.parseLenient(rawLines);
  }
}
