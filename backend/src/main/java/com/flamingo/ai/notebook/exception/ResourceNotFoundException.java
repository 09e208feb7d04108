package com.flamingo.ai.notebook.exception;

import java.util.UUID;

/** Base exception for an entity id that does not resolve to a record. */
public abstract class ResourceNotFoundException extends RuntimeException {

  private final String resourceType;
  private final UUID resourceId;

  protected ResourceNotFoundException(String resourceType, UUID resourceId) {
    super(resourceType + " not found: " + resourceId);
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public UUID getResourceId() {
    return resourceId;
  }
}
