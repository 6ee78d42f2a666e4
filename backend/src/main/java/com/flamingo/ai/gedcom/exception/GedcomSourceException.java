package com.flamingo.ai.gedcom.exception;

/** Exception thrown when an uploaded GEDCOM source cannot be read at all. */
public class GedcomSourceException extends RuntimeException {

  private final String userMessage;

  public GedcomSourceException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "The uploaded file could not be read";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
