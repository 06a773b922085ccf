package com.loandesk.controller;

import com.loandesk.api.SchedulerApi;
import com.loandesk.api.request.ManualSnapshotRequest;
import com.loandesk.api.response.SnapshotBatchResponse;
import com.loandesk.service.CommissionSnapshotBatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class SchedulerController implements SchedulerApi {

    private final CommissionSnapshotBatchService batchService;

    @Override
    public ResponseEntity<SnapshotBatchResponse> runCommissionSnapshots(ManualSnapshotRequest request) {
        log.info("Manual commission snapshot run requested: period={}-{}", request.year(), request.month());
        return ResponseEntity.ok(batchService.runBatch(request.year(), request.month()));
    }
}
