package com.loandesk.api.model;

/**
 * Lifecycle of a monthly commission snapshot.
 * <pre>
 * PENDING -> PROCESSED -> PAID
 * </pre>
 */
public enum SnapshotStatus {
    PENDING,
    PROCESSED,
    PAID
}
