package com.flamingo.ai.notebook.service.context;

import java.util.UUID;

/**
 * An excerpt of one source or note chosen as grounding material.
 *
 * @param relevance share of query terms found in the item, between 0 and 1
 */
public record ContextItem(
    ContextItemType type, UUID id, String title, String excerpt, double relevance) {}
