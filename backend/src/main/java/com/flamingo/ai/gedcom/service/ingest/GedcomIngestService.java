package com.flamingo.ai.gedcom.service.ingest;

import com.flamingo.ai.gedcom.service.genealogy.IndividualView;
import com.flamingo.ai.gedcom.service.genealogy.TreeStatistics;
import com.flamingo.ai.gedcom.service.loading.LoadResult;
import com.flamingo.ai.gedcom.service.rendering.RenderOptions;
import com.flamingo.ai.gedcom.service.validation.ValidationReport;
import java.util.List;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for working with uploaded GEDCOM files. */
public interface GedcomIngestService {

  /**
   * Runs the format validator over an uploaded file.
   *
   * @param file the uploaded GEDCOM file
   * @param maxLines maximum number of lines to check
   * @return the validation report; read failures are reported as issues
   */
  ValidationReport validate(MultipartFile file, int maxLines);

  /**
   * Loads an uploaded file with the robust loader.
   *
   * @param file the uploaded GEDCOM file
   * @return the load result
   * @throws com.flamingo.ai.gedcom.exception.GedcomLoadException if no stage could load it
   */
  LoadResult load(MultipartFile file);

  /** Computes record, individual and family counts for a loaded tree. */
  TreeStatistics statistics(LoadResult result);

  /**
   * Lists the individuals of an uploaded file, optionally filtered by name.
   *
   * @param file the uploaded GEDCOM file
   * @param search name fragment; {@code null} or blank lists everybody
   * @return matching individuals in document order
   */
  List<IndividualView> findIndividuals(MultipartFile file, String search);

  /**
   * Renders the AsciiDoc document for one individual of an uploaded file.
   *
   * @param file the uploaded GEDCOM file
   * @param individualId pointer with or without {@code @} wrappers
   * @param options render switches for this call
   * @return file name and content of the document
   * @throws com.flamingo.ai.gedcom.exception.IndividualNotFoundException if the id is unknown
   */
  RenderedDocument renderIndividual(MultipartFile file, String individualId, RenderOptions options);

  /**
   * A rendered document.
   *
   * @param fileName suggested file name
   * @param content document text
   */
  record RenderedDocument(String fileName, String content) {}
}
