package com.flamingo.ai.notebook.support;

import org.springframework.stereotype.Component;

/** Serializes order assignment within a single chat session. */
@Component
public class SessionLocks extends KeyedLocks {}
