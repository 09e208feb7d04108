package com.flamingo.ai.notebook.support;

import org.springframework.stereotype.Component;

/** Serializes writes to a single source record (status transitions and artifact upserts). */
@Component
public class SourceLocks extends KeyedLocks {}
