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
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Commission API: referral rates, KPI tiers, commission records, monthly snapshots and
 * revenue reporting.
 */
@RequestMapping("/api/v1/commissions")
public interface CommissionApi {

    @GetMapping("/configs")
    ResponseEntity<List<CommissionConfigDTO>> listConfigs();

    /**
     * Creates the active commission rate of a role. Only one active config per role may exist.
     */
    @PostMapping("/configs")
    ResponseEntity<CommissionConfigDTO> createConfig(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                                     @RequestBody @Valid CreateCommissionConfigRequest request);

    @PutMapping("/configs/{configId}")
    ResponseEntity<CommissionConfigDTO> updateConfig(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                                     @PathVariable("configId") UUID configId,
                                                     @RequestBody @Valid UpdateCommissionConfigRequest request);

    @GetMapping("/tiers")
    ResponseEntity<List<KpiTierDTO>> listTiers(@RequestParam(value = "roleCode", required = false) String roleCode);

    @PostMapping("/tiers")
    ResponseEntity<KpiTierDTO> createTier(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                          @RequestBody @Valid KpiTierRequest request);

    @PutMapping("/tiers/{tierId}")
    ResponseEntity<KpiTierDTO> updateTier(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                          @PathVariable("tierId") UUID tierId,
                                          @RequestBody @Valid KpiTierRequest request);

    /**
     * Deletes a KPI tier. Tiers referenced by a snapshot cannot be deleted.
     */
    @DeleteMapping("/tiers/{tierId}")
    ResponseEntity<Void> deleteTier(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                    @PathVariable("tierId") UUID tierId);

    @GetMapping("/records")
    ResponseEntity<PagedResponse<CommissionRecordDTO>> getMyRecords(
            @RequestHeader(ApiHeaders.USER_ID) UUID actorId,
            @RequestParam(value = "status", required = false) CommissionStatus status,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    /**
     * Wallet credits caused by commissions.
     */
    @GetMapping("/history")
    ResponseEntity<PagedResponse<WalletTransactionDTO>> getMyHistory(
            @RequestHeader(ApiHeaders.USER_ID) UUID actorId,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    @GetMapping("/summary")
    ResponseEntity<CommissionSummaryResponse> getMySummary(@RequestHeader(ApiHeaders.USER_ID) UUID actorId);

    @GetMapping("/snapshots/mine")
    ResponseEntity<PagedResponse<CommissionSnapshotDTO>> getMySnapshots(
            @RequestHeader(ApiHeaders.USER_ID) UUID actorId,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    @GetMapping("/snapshots")
    ResponseEntity<PagedResponse<CommissionSnapshotDTO>> searchSnapshots(
            @RequestParam(value = "year", required = false) Integer year,
            @RequestParam(value = "month", required = false) Integer month,
            @RequestParam(value = "status", required = false) SnapshotStatus status,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    /**
     * Pays the snapshot's KPI bonus into the user's wallet and marks it PROCESSED.
     */
    @PostMapping("/snapshots/{snapshotId}/process")
    ResponseEntity<CommissionSnapshotDTO> processSnapshot(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                                          @PathVariable("snapshotId") UUID snapshotId);

    @PostMapping("/snapshots/{snapshotId}/paid")
    ResponseEntity<CommissionSnapshotDTO> markSnapshotPaid(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                                           @PathVariable("snapshotId") UUID snapshotId);

    @GetMapping("/statistics/revenue")
    ResponseEntity<RevenueStatisticsResponse> getRevenueStatistics(
            @RequestParam("period") StatisticPeriod period,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date);

    @GetMapping("/statistics/revenue/creators")
    ResponseEntity<List<CreatorRevenueResponse>> getRevenueByCreator(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to);
}
