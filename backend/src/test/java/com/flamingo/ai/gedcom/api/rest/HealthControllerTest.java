package com.flamingo.ai.gedcom.api.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.gedcom.service.loading.LoadStage;
import com.flamingo.ai.gedcom.service.loading.LoadStrategy;
import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("HealthController Tests")
class HealthControllerTest {

  private static LoadStrategy strategy(LoadStage stage) {
    return new LoadStrategy() {
      @Override
      public LoadStage stage() {
        return stage;
      }

      @Override
      public RecordTree load(List<String> lines) {
        throw new UnsupportedOperationException();
      }
    };
  }

  @Test
  @DisplayName("should report status and load stages in order")
  void shouldReportStatusAndStages() throws Exception {
    MockMvc mockMvc =
        MockMvcBuilders.standaloneSetup(
                new HealthController(
                    List.of(
                        strategy(LoadStage.LENIENT_PARSE),
                        strategy(LoadStage.PREPROCESS_AND_BUILD),
                        strategy(LoadStage.DIRECT_BUILD))))
            .build();

    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.service").value("gedcom-ingest"))
        .andExpect(jsonPath("$.loadStages[0]").value("PREPROCESS_AND_BUILD"))
        .andExpect(jsonPath("$.loadStages[2]").value("LENIENT_PARSE"));
  }
}
