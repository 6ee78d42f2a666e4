package com.flamingo.ai.gedcom.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the GEDCOM ingestion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "ingest")
@Getter
@Setter
public class IngestConfig {

  private Preprocessing preprocessing = new Preprocessing();
  private Lenient lenient = new Lenient();
  private Validation validation = new Validation();
  private Rendering rendering = new Rendering();

  @Getter
  @Setter
  public static class Preprocessing {
    /** Tag given to synthetic continuation records. */
    private String continuationTag = "CONT";

    /** Depth used for an orphan fragment that has no preceding record to attach to. */
    private int fallbackDepth = 1;

    /** Orphan fragments starting with one of these are never merged into a previous line. */
    private List<String> uriPrefixes =
        new ArrayList<>(List.of("http://", "https://", "ftp://", "file://", "mailto:", "www."));

    /** Orphan fragments starting with this character are treated as markup and never merged. */
    private char markupOpenChar = '<';

    /**
     * Whether the normalized text is spooled to a temporary file before tree building. The file is
     * removed as soon as the build attempt finishes.
     */
    private boolean spoolToDisk = true;
  }

  @Getter
  @Setter
  public static class Lenient {
    /** Neutral tag substituted for lines whose payload carries embedded markup. */
    private String placeholderTag = "NOTE";
  }

  @Getter
  @Setter
  public static class Validation {
    private int maxLines = 1000;

    /** Offending content longer than this is truncated in reported issues. */
    private int previewLength = 50;
  }

  /** Defaults for {@link com.flamingo.ai.gedcom.service.rendering.RenderOptions}. */
  @Getter
  @Setter
  public static class Rendering {
    private boolean tableOfContents = true;
    private boolean numberedSections = true;
    private boolean familyDiagram = false;
  }
}
