package com.loandesk.api.response;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a monthly snapshot batch.
 */
public record SnapshotBatchResponse(
        int year,
        int month,
        int totalUsers,
        int successCount,
        int errorCount,
        List<UserResult> results
) {
    /**
     * @param snapshotId created or existing snapshot, {@code null} on failure
     * @param error      failure message, {@code null} on success
     */
    public record UserResult(
            UUID userId,
            boolean success,
            UUID snapshotId,
            String error
    ) {}
}
