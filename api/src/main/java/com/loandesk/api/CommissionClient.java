package com.loandesk.api;

import com.loandesk.api.dto.CommissionConfigDTO;
import com.loandesk.api.dto.CommissionRecordDTO;
import com.loandesk.api.dto.CommissionSnapshotDTO;
import com.loandesk.api.dto.KpiTierDTO;
import com.loandesk.api.dto.PagedResponse;
import com.loandesk.api.dto.WalletTransactionDTO;
import com.loandesk.api.model.CommissionStatus;
import com.loandesk.api.model.SnapshotStatus;
import com.loandesk.api.model.StatisticPeriod;
import com.loandesk.api.request.CreateCommissionConfigRequest;
import com.loandesk.api.request.KpiTierRequest;
import com.loandesk.api.request.UpdateCommissionConfigRequest;
import com.loandesk.api.response.CommissionSummaryResponse;
import com.loandesk.api.response.CreatorRevenueResponse;
import com.loandesk.api.response.RevenueStatisticsResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * WebClient-based implementation of CommissionApi.
 */
@RequiredArgsConstructor
@Slf4j
public class CommissionClient implements CommissionApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<List<CommissionConfigDTO>> listConfigs() {
        return webClient.get()
                .uri("/api/v1/commissions/configs")
                .retrieve()
                .toEntityList(CommissionConfigDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<CommissionConfigDTO> createConfig(UUID actorId, CreateCommissionConfigRequest request) {
        log.debug("Calling createConfig: roleCode={}, rate={}", request.roleCode(), request.rate());

        return webClient.post()
                .uri("/api/v1/commissions/configs")
                .header(ApiHeaders.USER_ID, actorId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntity(CommissionConfigDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<CommissionConfigDTO> updateConfig(UUID actorId, UUID configId,
                                                            UpdateCommissionConfigRequest request) {
        log.debug("Calling updateConfig: configId={}", configId);

        return webClient.put()
                .uri("/api/v1/commissions/configs/{configId}", configId)
                .header(ApiHeaders.USER_ID, actorId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntity(CommissionConfigDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<List<KpiTierDTO>> listTiers(String roleCode) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/commissions/tiers")
                        .queryParamIfPresent("roleCode", Optional.ofNullable(roleCode))
                        .build())
                .retrieve()
                .toEntityList(KpiTierDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<KpiTierDTO> createTier(UUID actorId, KpiTierRequest request) {
        log.debug("Calling createTier: name={}, roleCode={}", request.name(), request.roleCode());

        return webClient.post()
                .uri("/api/v1/commissions/tiers")
                .header(ApiHeaders.USER_ID, actorId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntity(KpiTierDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<KpiTierDTO> updateTier(UUID actorId, UUID tierId, KpiTierRequest request) {
        log.debug("Calling updateTier: tierId={}", tierId);

        return webClient.put()
                .uri("/api/v1/commissions/tiers/{tierId}", tierId)
                .header(ApiHeaders.USER_ID, actorId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntity(KpiTierDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<Void> deleteTier(UUID actorId, UUID tierId) {
        log.debug("Calling deleteTier: tierId={}", tierId);

        return webClient.delete()
                .uri("/api/v1/commissions/tiers/{tierId}", tierId)
                .header(ApiHeaders.USER_ID, actorId.toString())
                .retrieve()
                .toBodilessEntity()
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<CommissionRecordDTO>> getMyRecords(UUID actorId, CommissionStatus status,
                                                                           int page, int size) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/commissions/records")
                        .queryParamIfPresent("status", Optional.ofNullable(status))
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .header(ApiHeaders.USER_ID, actorId.toString())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<CommissionRecordDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<WalletTransactionDTO>> getMyHistory(UUID actorId, int page, int size) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/commissions/history")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .header(ApiHeaders.USER_ID, actorId.toString())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<WalletTransactionDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<CommissionSummaryResponse> getMySummary(UUID actorId) {
        return webClient.get()
                .uri("/api/v1/commissions/summary")
                .header(ApiHeaders.USER_ID, actorId.toString())
                .retrieve()
                .toEntity(CommissionSummaryResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<CommissionSnapshotDTO>> getMySnapshots(UUID actorId, int page, int size) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/commissions/snapshots/mine")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .header(ApiHeaders.USER_ID, actorId.toString())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<CommissionSnapshotDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<CommissionSnapshotDTO>> searchSnapshots(Integer year, Integer month,
                                                                                SnapshotStatus status,
                                                                                int page, int size) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/commissions/snapshots")
                        .queryParamIfPresent("year", Optional.ofNullable(year))
                        .queryParamIfPresent("month", Optional.ofNullable(month))
                        .queryParamIfPresent("status", Optional.ofNullable(status))
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<CommissionSnapshotDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<CommissionSnapshotDTO> processSnapshot(UUID actorId, UUID snapshotId) {
        log.debug("Calling processSnapshot: snapshotId={}, actorId={}", snapshotId, actorId);

        return webClient.post()
                .uri("/api/v1/commissions/snapshots/{snapshotId}/process", snapshotId)
                .header(ApiHeaders.USER_ID, actorId.toString())
                .retrieve()
                .toEntity(CommissionSnapshotDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<CommissionSnapshotDTO> markSnapshotPaid(UUID actorId, UUID snapshotId) {
        log.debug("Calling markSnapshotPaid: snapshotId={}, actorId={}", snapshotId, actorId);

        return webClient.post()
                .uri("/api/v1/commissions/snapshots/{snapshotId}/paid", snapshotId)
                .header(ApiHeaders.USER_ID, actorId.toString())
                .retrieve()
                .toEntity(CommissionSnapshotDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<RevenueStatisticsResponse> getRevenueStatistics(StatisticPeriod period, LocalDate date) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/commissions/statistics/revenue")
                        .queryParam("period", period)
                        .queryParam("date", date)
                        .build())
                .retrieve()
                .toEntity(RevenueStatisticsResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<CreatorRevenueResponse>> getRevenueByCreator(LocalDate from, LocalDate to) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/commissions/statistics/revenue/creators")
                        .queryParam("from", from)
                        .queryParam("to", to)
                        .build())
                .retrieve()
                .toEntityList(CreatorRevenueResponse.class)
                .block();
    }
}
