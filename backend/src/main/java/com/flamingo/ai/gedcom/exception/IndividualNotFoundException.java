package com.flamingo.ai.gedcom.exception;

/** Exception thrown when an individual pointer does not resolve to an INDI record. */
public class IndividualNotFoundException extends RuntimeException {

  private final String individualId;

  public IndividualNotFoundException(String individualId) {
    super("Individual not found: " + individualId);
    this.individualId = individualId;
  }

  public String getIndividualId() {
    return individualId;
  }
}
