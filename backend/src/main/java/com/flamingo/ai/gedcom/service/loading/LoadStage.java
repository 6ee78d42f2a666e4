package com.flamingo.ai.gedcom.service.loading;

import java.util.Locale;

/** The interpretations tried by {@link RobustGedcomLoader}, in the order they are attempted. */
public enum LoadStage {
  PREPROCESS_AND_BUILD("Preprocessing"),
  DIRECT_BUILD("Direct parsing"),
  LENIENT_PARSE("Lenient parsing");

  private final String displayName;

  LoadStage(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }

  /** Lower-case tag value used for metrics. */
  public String metricTag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
