package com.charthost.common.model;

/**
 * What a batch item did to the store. {@code put} only ever reports
 * {@link #INSERTED} or {@link #UPDATED}; {@link #CACHED} marks a batch item
 * served from a fresh artifact without touching the store.
 */
public enum CommitKind {
    INSERTED,
    UPDATED,
    CACHED
}
