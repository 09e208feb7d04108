package com.flamingo.ai.notebook.service.context;

/** Kind of notebook content a context item was taken from. */
public enum ContextItemType {
  SOURCE,
  NOTE
}
