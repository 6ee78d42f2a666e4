package com.flamingo.ai.gedcom.service.rendering;

import com.flamingo.ai.gedcom.config.IngestConfig;

/**
 * Per-call switches for document rendering. Passed explicitly to every render call so concurrent
 * renders never influence each other.
 *
 * @param tableOfContents emit the {@code :toc:} header
 * @param numberedSections emit the {@code :numbered:} header
 * @param familyDiagram emit a graphviz block with the individual's immediate family
 */
public record RenderOptions(
    boolean tableOfContents, boolean numberedSections, boolean familyDiagram) {

  /** Options taken from {@code ingest.rendering.*}. */
  public static RenderOptions defaults(IngestConfig config) {
    IngestConfig.Rendering r = config.getRendering();
    return new RenderOptions(r.isTableOfContents(), r.isNumberedSections(), r.isFamilyDiagram());
  }

  public RenderOptions withTableOfContents(boolean enabled) {
    return new RenderOptions(enabled, numberedSections, familyDiagram);
  }

  public RenderOptions withFamilyDiagram(boolean enabled) {
    return new RenderOptions(tableOfContents, numberedSections, enabled);
  }
}
