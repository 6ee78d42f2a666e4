package com.flamingo.ai.gedcom.service.ingest;

import com.flamingo.ai.gedcom.exception.GedcomSourceException;
import com.flamingo.ai.gedcom.service.genealogy.GenealogyQueryService;
import com.flamingo.ai.gedcom.service.genealogy.IndividualView;
import com.flamingo.ai.gedcom.service.genealogy.TreeStatistics;
import com.flamingo.ai.gedcom.service.loading.LoadResult;
import com.flamingo.ai.gedcom.service.loading.RobustGedcomLoader;
import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;
import com.flamingo.ai.gedcom.service.rendering.DocumentRenderer;
import com.flamingo.ai.gedcom.service.rendering.RenderOptions;
import com.flamingo.ai.gedcom.service.validation.GedcomFormatValidator;
import com.flamingo.ai.gedcom.service.validation.ValidationReport;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the GedcomIngestService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class GedcomIngestServiceImpl implements GedcomIngestService {

  private final GedcomFormatValidator validator;
  private final RobustGedcomLoader loader;
  private final GenealogyQueryService genealogyQueryService;
  private final DocumentRenderer documentRenderer;
  private final MeterRegistry meterRegistry;

  @Override
  public ValidationReport validate(MultipartFile file, int maxLines) {
    log.info("Validating {} (up to {} lines)", file.getOriginalFilename(), maxLines);
    try (InputStream in = file.getInputStream()) {
      ValidationReport report = validator.validate(in, maxLines);
      meterRegistry
          .counter("gedcom.validated", "valid", String.valueOf(report.valid()))
          .increment();
      return report;
    } catch (IOException e) {
      throw new GedcomSourceException(
          "Failed to open upload " + file.getOriginalFilename() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public LoadResult load(MultipartFile file) {
    log.info("Loading {} ({} bytes)", file.getOriginalFilename(), file.getSize());
    try (InputStream in = file.getInputStream()) {
      return loader.load(in);
    } catch (IOException e) {
      throw new GedcomSourceException(
          "Failed to open upload " + file.getOriginalFilename() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public TreeStatistics statistics(LoadResult result) {
    return genealogyQueryService.statistics(result.tree());
  }

  @Override
  public List<IndividualView> findIndividuals(MultipartFile file, String search) {
    RecordTree tree = load(file).tree();
    if (search == null || search.isBlank()) {
      return genealogyQueryService.listIndividuals(tree);
    }
    List<IndividualView> matches = genealogyQueryService.searchIndividuals(tree, search);
    log.info("Search '{}' matched {} individuals", search, matches.size());
    return matches;
  }

  @Override
  public RenderedDocument renderIndividual(
      MultipartFile file, String individualId, RenderOptions options) {
    RecordTree tree = load(file).tree();
    IndividualView individual = genealogyQueryService.findIndividual(tree, individualId);
    String content = documentRenderer.render(tree, individual, options);
    meterRegistry.counter("gedcom.rendered").increment();
    return new RenderedDocument(documentRenderer.suggestedFileName(individual), content);
  }
}
