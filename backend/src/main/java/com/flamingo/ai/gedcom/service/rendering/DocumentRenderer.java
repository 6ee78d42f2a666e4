package com.flamingo.ai.gedcom.service.rendering;

import com.flamingo.ai.gedcom.service.genealogy.IndividualView;
import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;

/**
 * Renders a human-readable document about one individual of a loaded tree.
 *
 * <p>Implementations only read the tree; they must be stateless so one instance can serve
 * concurrent requests.
 */
public interface DocumentRenderer {

  /**
   * Renders the document.
   *
   * @param tree the loaded tree, used to resolve relatives
   * @param individual the main person of the document
   * @param options switches for optional document parts
   * @return the rendered document text
   */
  String render(RecordTree tree, IndividualView individual, RenderOptions options);

  /** Returns a file name for the rendered document, derived from the individual's name. */
  String suggestedFileName(IndividualView individual);
}
