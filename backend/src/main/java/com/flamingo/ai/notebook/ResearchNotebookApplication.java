package com.flamingo.ai.notebook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Research notebook backend: source ingestion, transformations and grounded chat. */
@SpringBootApplication
public class ResearchNotebookApplication {

  public static void main(String[] args) {
    SpringApplication.run(ResearchNotebookApplication.class, args);
  }
}
