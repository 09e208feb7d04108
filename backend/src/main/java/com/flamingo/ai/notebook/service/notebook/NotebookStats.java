package com.flamingo.ai.notebook.service.notebook;

/** Counts shown alongside a notebook. */
public record NotebookStats(
    long sourceCount, long noteCount, long chatSessionCount, long openTaskCount) {}
