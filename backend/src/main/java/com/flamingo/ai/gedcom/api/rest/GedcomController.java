package com.flamingo.ai.gedcom.api.rest;

import com.flamingo.ai.gedcom.api.dto.response.IndividualResponse;
import com.flamingo.ai.gedcom.api.dto.response.ParseSummaryResponse;
import com.flamingo.ai.gedcom.config.IngestConfig;
import com.flamingo.ai.gedcom.service.ingest.GedcomIngestService;
import com.flamingo.ai.gedcom.service.loading.LoadResult;
import com.flamingo.ai.gedcom.service.rendering.RenderOptions;
import com.flamingo.ai.gedcom.service.validation.ValidationReport;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for validating, loading and rendering uploaded GEDCOM files. */
@RestController
@RequestMapping("/api/gedcom")
@RequiredArgsConstructor
public class GedcomController {

  private final GedcomIngestService ingestService;
  private final IngestConfig ingestConfig;

  /** Reports lines that do not start with a level number. */
  @PostMapping(value = "/validate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ValidationReport> validate(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "maxLines", required = false) Integer maxLines) {
    int limit =
        maxLines != null && maxLines > 0 ? maxLines : ingestConfig.getValidation().getMaxLines();
    return ResponseEntity.ok(ingestService.validate(file, limit));
  }

  /** Loads the file and summarises the resulting tree. */
  @PostMapping(value = "/parse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ParseSummaryResponse> parse(@RequestParam("file") MultipartFile file) {
    LoadResult result = ingestService.load(file);
    return ResponseEntity.ok(
        ParseSummaryResponse.from(result, ingestService.statistics(result)));
  }

  /** Lists individuals, optionally filtered by a name fragment. */
  @PostMapping(value = "/individuals", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<List<IndividualResponse>> individuals(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "search", required = false) String search) {
    List<IndividualResponse> individuals =
        ingestService.findIndividuals(file, search).stream()
            .map(IndividualResponse::fromView)
            .toList();
    return ResponseEntity.ok(individuals);
  }

  /** Renders the AsciiDoc document for one individual. */
  @PostMapping(
      value = "/individuals/{individualId}/asciidoc",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<String> renderAsciiDoc(
      @PathVariable String individualId,
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "toc", required = false) Boolean toc,
      @RequestParam(value = "diagram", required = false) Boolean diagram) {
    RenderOptions options = RenderOptions.defaults(ingestConfig);
    if (toc != null) {
      options = options.withTableOfContents(toc);
    }
    if (diagram != null) {
      options = options.withFamilyDiagram(diagram);
    }
    GedcomIngestService.RenderedDocument document =
        ingestService.renderIndividual(file, individualId, options);
    return ResponseEntity.ok()
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            "attachment; filename=\"" + document.fileName() + "\"")
        .contentType(MediaType.TEXT_PLAIN)
        .body(document.content());
  }
}
