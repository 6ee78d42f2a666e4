package com.flamingo.ai.gedcom;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the GEDCOM ingestion service. */
@SpringBootApplication
public class GedcomIngestApplication {

  public static void main(String[] args) {
    SpringApplication.run(GedcomIngestApplication.class, args);
  }
}
