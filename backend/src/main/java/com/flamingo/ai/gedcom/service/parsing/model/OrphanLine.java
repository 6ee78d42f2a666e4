package com.flamingo.ai.gedcom.service.parsing.model;

/**
 * A non-blank line without a depth prefix, usually free text split off a previous record.
 *
 * @param text the stripped line content
 */
public record OrphanLine(String text) implements ClassifiedLine {

  @Override
  public String format() {
    return text;
  }
}
