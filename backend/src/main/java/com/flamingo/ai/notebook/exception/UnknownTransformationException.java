package com.flamingo.ai.notebook.exception;

/** Exception thrown when no transformation is configured under the requested name. */
public class UnknownTransformationException extends RuntimeException {

  private final String transformationName;

  public UnknownTransformationException(String transformationName) {
    super("Unknown transformation: " + transformationName);
    this.transformationName = transformationName;
  }

  public String getTransformationName() {
    return transformationName;
  }
}
