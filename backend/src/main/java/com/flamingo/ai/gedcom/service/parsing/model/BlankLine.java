package com.flamingo.ai.gedcom.service.parsing.model;

/** A line holding nothing but whitespace. */
public record BlankLine() implements ClassifiedLine {

  public static final BlankLine INSTANCE = new BlankLine();

  @Override
  public String format() {
    return "";
  }
}
