package com.gentoro.reformat.export;

import com.gentoro.reformat.model.ItemResult;

/** Running totals of an export, published after every item resolves. */
public record ExportProgress(
    String runId,
    int total,
    int completed,
    int succeeded,
    int failed,
    int canceled,
    ItemResult latest) {}
