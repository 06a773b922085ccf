package com.loandesk.api;

import com.loandesk.api.request.ManualSnapshotRequest;
import com.loandesk.api.response.SnapshotBatchResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Admin entry points of scheduled jobs.
 */
@RequestMapping("/api/v1/scheduler")
public interface SchedulerApi {

    /**
     * Runs the monthly commission snapshot batch for an explicit period, e.g. for backfills.
     */
    @PostMapping("/commission-snapshots")
    ResponseEntity<SnapshotBatchResponse> runCommissionSnapshots(@RequestBody @Valid ManualSnapshotRequest request);
}
