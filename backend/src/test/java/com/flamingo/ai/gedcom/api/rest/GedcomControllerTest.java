package com.flamingo.ai.gedcom.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.gedcom.config.IngestConfig;
import com.flamingo.ai.gedcom.exception.GedcomLoadException;
import com.flamingo.ai.gedcom.exception.GedcomSourceException;
import com.flamingo.ai.gedcom.exception.GlobalExceptionHandler;
import com.flamingo.ai.gedcom.exception.IndividualNotFoundException;
import com.flamingo.ai.gedcom.exception.StructuralFailureException;
import com.flamingo.ai.gedcom.service.genealogy.IndividualView;
import com.flamingo.ai.gedcom.service.genealogy.LifeEvent;
import com.flamingo.ai.gedcom.service.genealogy.TreeStatistics;
import com.flamingo.ai.gedcom.service.ingest.GedcomIngestService;
import com.flamingo.ai.gedcom.service.loading.LoadResult;
import com.flamingo.ai.gedcom.service.loading.LoadStage;
import com.flamingo.ai.gedcom.service.loading.StageFailure;
import com.flamingo.ai.gedcom.service.parsing.model.AncestorStack;
import com.flamingo.ai.gedcom.service.parsing.model.LeveledLine;
import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;
import com.flamingo.ai.gedcom.service.rendering.RenderOptions;
import com.flamingo.ai.gedcom.service.validation.ValidationIssue;
import com.flamingo.ai.gedcom.service.validation.ValidationReport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("GedcomController Tests")
class GedcomControllerTest {

  private static final MockMultipartFile UPLOAD =
      new MockMultipartFile(
          "file", "tree.ged", "text/plain", "0 HEAD\n0 TRLR\n".getBytes(StandardCharsets.UTF_8));

  @Mock private GedcomIngestService ingestService;

  private MeterRegistry meterRegistry;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new GedcomController(ingestService, new IngestConfig()))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  private static RecordTree headOnlyTree() {
    AncestorStack stack = new AncestorStack();
    stack.attach(new LeveledLine(0, null, "HEAD", null));
    return stack.finish();
  }

  @Nested
  @DisplayName("POST /api/gedcom/validate")
  class Validate {

    @Test
    @DisplayName("should return the validation report")
    void shouldReturnReport() throws Exception {
      when(ingestService.validate(any(), eq(1000)))
          .thenReturn(
              new ValidationReport(
                  false,
                  3,
                  1,
                  List.of(
                      new ValidationIssue(
                          2,
                          ValidationIssue.INVALID_FORMAT,
                          "Line does not start with level number",
                          "stray"))));

      mockMvc
          .perform(multipart("/api/gedcom/validate").file(UPLOAD))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.valid").value(false))
          .andExpect(jsonPath("$.linesChecked").value(3))
          .andExpect(jsonPath("$.issues[0].line").value(2))
          .andExpect(jsonPath("$.issues[0].type").value("invalid_format"));
    }

    @Test
    @DisplayName("should pass an explicit line limit")
    void shouldPassLineLimit() throws Exception {
      when(ingestService.validate(any(), eq(25)))
          .thenReturn(new ValidationReport(true, 2, 0, List.of()));

      mockMvc
          .perform(multipart("/api/gedcom/validate").file(UPLOAD).param("maxLines", "25"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.valid").value(true));
    }

    @Test
    @DisplayName("should reject a request without file")
    void shouldRejectMissingFile() throws Exception {
      mockMvc
          .perform(multipart("/api/gedcom/validate"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"));
    }
  }

  @Nested
  @DisplayName("POST /api/gedcom/parse")
  class Parse {

    @Test
    @DisplayName("should summarise the load")
    void shouldSummariseLoad() throws Exception {
      LoadResult result =
          new LoadResult(
              headOnlyTree(),
              LoadStage.DIRECT_BUILD,
              List.of(
                  new StageFailure(
                      LoadStage.PREPROCESS_AND_BUILD, "StructuralFailureException", "boom")));
      when(ingestService.load(any())).thenReturn(result);
      when(ingestService.statistics(result)).thenReturn(new TreeStatistics(1, 0, 0));

      mockMvc
          .perform(multipart("/api/gedcom/parse").file(UPLOAD))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.stage").value("DIRECT_BUILD"))
          .andExpect(jsonPath("$.recordCount").value(1))
          .andExpect(jsonPath("$.fallbackFailures[0]").value("Preprocessing error: boom"));
    }

    @Test
    @DisplayName("should return 422 with every stage failure when loading fails")
    void shouldReturnUnprocessableWhenAllStagesFail() throws Exception {
      when(ingestService.load(any()))
          .thenThrow(
              new GedcomLoadException(
                  List.of(
                      new StageFailure(LoadStage.PREPROCESS_AND_BUILD, "X", "a"),
                      new StageFailure(LoadStage.DIRECT_BUILD, "X", "b"),
                      new StageFailure(LoadStage.LENIENT_PARSE, "X", "c"))));

      mockMvc
          .perform(multipart("/api/gedcom/parse").file(UPLOAD))
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.code").value("GEDCOM_001"))
          .andExpect(jsonPath("$.details.length()").value(3))
          .andExpect(jsonPath("$.details[2]").value("Lenient parsing error: c"))
          .andExpect(jsonPath("$.path").value("/api/gedcom/parse"));

      assertThat(
              meterRegistry
                  .counter("api_errors_total", "error_type", "gedcom_load_failed")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should return 400 when the upload cannot be read")
    void shouldReturnBadRequestForUnreadableUpload() throws Exception {
      when(ingestService.load(any()))
          .thenThrow(new GedcomSourceException("closed", new IOException("closed")));

      mockMvc
          .perform(multipart("/api/gedcom/parse").file(UPLOAD))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("GEDCOM_003"));
    }

    @Test
    @DisplayName("should hide unexpected errors behind a generic message")
    void shouldHideUnexpectedErrors() throws Exception {
      when(ingestService.load(any())).thenThrow(new StructuralFailureException("internal detail"));

      mockMvc
          .perform(multipart("/api/gedcom/parse").file(UPLOAD))
          .andExpect(status().isInternalServerError())
          .andExpect(jsonPath("$.code").value("INTERNAL_001"))
          .andExpect(
              jsonPath("$.message").value("An unexpected error occurred. Please try again later."));
    }
  }

  @Nested
  @DisplayName("POST /api/gedcom/individuals")
  class Individuals {

    @Test
    @DisplayName("should list matching individuals")
    void shouldListIndividuals() throws Exception {
      when(ingestService.findIndividuals(any(), eq("smith")))
          .thenReturn(
              List.of(
                  new IndividualView(
                      "@I1@",
                      "John",
                      "Smith",
                      "M",
                      new LifeEvent("1 JAN 1900", "Stockholm"),
                      null,
                      null)));

      mockMvc
          .perform(multipart("/api/gedcom/individuals").file(UPLOAD).param("search", "smith"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.length()").value(1))
          .andExpect(jsonPath("$[0].id").value("@I1@"))
          .andExpect(jsonPath("$[0].name").value("John Smith"))
          .andExpect(jsonPath("$[0].birthPlace").value("Stockholm"));
    }
  }

  @Nested
  @DisplayName("POST /api/gedcom/individuals/{id}/asciidoc")
  class RenderAsciiDoc {

    @Test
    @DisplayName("should return the document as an attachment")
    void shouldReturnAttachment() throws Exception {
      when(ingestService.renderIndividual(any(), eq("I1"), any()))
          .thenReturn(new GedcomIngestService.RenderedDocument("john.adoc", "= John Smith"));

      mockMvc
          .perform(multipart("/api/gedcom/individuals/I1/asciidoc").file(UPLOAD))
          .andExpect(status().isOk())
          .andExpect(header().string("Content-Disposition", "attachment; filename=\"john.adoc\""))
          .andExpect(content().string("= John Smith"));
    }

    @Test
    @DisplayName("should apply per-request render switches over the defaults")
    void shouldApplyRenderSwitches() throws Exception {
      when(ingestService.renderIndividual(any(), eq("I1"), any()))
          .thenReturn(new GedcomIngestService.RenderedDocument("john.adoc", "= John Smith"));

      mockMvc
          .perform(
              multipart("/api/gedcom/individuals/I1/asciidoc")
                  .file(UPLOAD)
                  .param("toc", "false")
                  .param("diagram", "true"))
          .andExpect(status().isOk());

      ArgumentCaptor<RenderOptions> options = ArgumentCaptor.forClass(RenderOptions.class);
      verify(ingestService).renderIndividual(any(), eq("I1"), options.capture());
      assertThat(options.getValue()).isEqualTo(new RenderOptions(false, true, true));
    }

    @Test
    @DisplayName("should return 404 for an unknown individual")
    void shouldReturnNotFound() throws Exception {
      when(ingestService.renderIndividual(any(), eq("I99"), any()))
          .thenThrow(new IndividualNotFoundException("I99"));

      mockMvc
          .perform(multipart("/api/gedcom/individuals/I99/asciidoc").file(UPLOAD))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.code").value("GEDCOM_002"))
          .andExpect(jsonPath("$.message").value("Individual not found: I99"));
    }
  }
}
