package com.loandesk.api;

import com.loandesk.api.request.ManualSnapshotRequest;
import com.loandesk.api.response.SnapshotBatchResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

@RequiredArgsConstructor
@Slf4j
public class SchedulerClient implements SchedulerApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<SnapshotBatchResponse> runCommissionSnapshots(ManualSnapshotRequest request) {
        log.debug("Calling runCommissionSnapshots: year={}, month={}", request.year(), request.month());

        return webClient.post()
                .uri("/api/v1/scheduler/commission-snapshots")
                .bodyValue(request)
                .retrieve()
                .toEntity(SnapshotBatchResponse.class)
                .block();
    }
}
