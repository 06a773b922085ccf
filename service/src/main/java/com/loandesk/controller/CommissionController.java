package com.loandesk.controller;

import com.loandesk.api.CommissionApi;
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
import com.loandesk.mapper.CommissionMapper;
import com.loandesk.mapper.WalletMapper;
import com.loandesk.model.CommissionRecord;
import com.loandesk.model.CommissionSnapshot;
import com.loandesk.model.WalletTransaction;
import com.loandesk.service.CommissionService;
import com.loandesk.service.CommissionSnapshotService;
import com.loandesk.service.KpiTierService;
import com.loandesk.service.RevenueStatisticService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class CommissionController implements CommissionApi {

    private final CommissionService commissionService;
    private final KpiTierService kpiTierService;
    private final CommissionSnapshotService snapshotService;
    private final RevenueStatisticService revenueStatisticService;
    private final Paging paging;

    // ==================== Configs ====================

    @Override
    public ResponseEntity<List<CommissionConfigDTO>> listConfigs() {
        return ResponseEntity.ok(CommissionMapper.INSTANCE.toConfigDTOList(commissionService.listConfigs()));
    }

    @Override
    public ResponseEntity<CommissionConfigDTO> createConfig(UUID actorId, CreateCommissionConfigRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommissionMapper.INSTANCE.toDTO(commissionService.createConfig(request, actorId)));
    }

    @Override
    public ResponseEntity<CommissionConfigDTO> updateConfig(UUID actorId, UUID configId,
                                                            UpdateCommissionConfigRequest request) {
        return ResponseEntity.ok(CommissionMapper.INSTANCE.toDTO(
                commissionService.updateConfig(configId, request, actorId)));
    }

    // ==================== KPI tiers ====================

    @Override
    public ResponseEntity<List<KpiTierDTO>> listTiers(String roleCode) {
        return ResponseEntity.ok(CommissionMapper.INSTANCE.toTierDTOList(kpiTierService.listTiers(roleCode)));
    }

    @Override
    public ResponseEntity<KpiTierDTO> createTier(UUID actorId, KpiTierRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommissionMapper.INSTANCE.toDTO(kpiTierService.createTier(request, actorId)));
    }

    @Override
    public ResponseEntity<KpiTierDTO> updateTier(UUID actorId, UUID tierId, KpiTierRequest request) {
        return ResponseEntity.ok(CommissionMapper.INSTANCE.toDTO(kpiTierService.updateTier(tierId, request, actorId)));
    }

    @Override
    public ResponseEntity<Void> deleteTier(UUID actorId, UUID tierId) {
        kpiTierService.deleteTier(tierId, actorId);
        return ResponseEntity.noContent().build();
    }

    // ==================== Records ====================

    @Override
    public ResponseEntity<PagedResponse<CommissionRecordDTO>> getMyRecords(UUID actorId, CommissionStatus status,
                                                                           int page, int size) {
        Page<CommissionRecord> records = commissionService.getCommissionRecords(actorId, status, paging.of(page, size));
        PagedResponse<CommissionRecordDTO> response = Paging.toResponse(records, CommissionMapper.INSTANCE::toDTO);
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<PagedResponse<WalletTransactionDTO>> getMyHistory(UUID actorId, int page, int size) {
        Page<WalletTransaction> history = commissionService.getCommissionHistory(actorId, paging.of(page, size));
        PagedResponse<WalletTransactionDTO> response = Paging.toResponse(history, WalletMapper.INSTANCE::toDTO);
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<CommissionSummaryResponse> getMySummary(UUID actorId) {
        return ResponseEntity.ok(commissionService.getUserCommissionSummary(actorId));
    }

    // ==================== Snapshots ====================

    @Override
    public ResponseEntity<PagedResponse<CommissionSnapshotDTO>> getMySnapshots(UUID actorId, int page, int size) {
        Page<CommissionSnapshot> snapshots = snapshotService.getUserSnapshots(actorId, paging.of(page, size));
        PagedResponse<CommissionSnapshotDTO> response = Paging.toResponse(snapshots, CommissionMapper.INSTANCE::toDTO);
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<PagedResponse<CommissionSnapshotDTO>> searchSnapshots(Integer year, Integer month,
                                                                               SnapshotStatus status, int page,
                                                                               int size) {
        Page<CommissionSnapshot> snapshots = snapshotService.searchSnapshots(year, month, status,
                paging.of(page, size));
        PagedResponse<CommissionSnapshotDTO> response = Paging.toResponse(snapshots, CommissionMapper.INSTANCE::toDTO);
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<CommissionSnapshotDTO> processSnapshot(UUID actorId, UUID snapshotId) {
        return ResponseEntity.ok(CommissionMapper.INSTANCE.toDTO(snapshotService.processSnapshotBonus(snapshotId, actorId)));
    }

    @Override
    public ResponseEntity<CommissionSnapshotDTO> markSnapshotPaid(UUID actorId, UUID snapshotId) {
        return ResponseEntity.ok(CommissionMapper.INSTANCE.toDTO(snapshotService.markSnapshotPaid(snapshotId, actorId)));
    }

    // ==================== Statistics ====================

    @Override
    public ResponseEntity<RevenueStatisticsResponse> getRevenueStatistics(StatisticPeriod period, LocalDate date) {
        return ResponseEntity.ok(revenueStatisticService.getRevenueStatistics(period, date));
    }

    @Override
    public ResponseEntity<List<CreatorRevenueResponse>> getRevenueByCreator(LocalDate from, LocalDate to) {
        return ResponseEntity.ok(revenueStatisticService.getRevenueByCreator(from, to));
    }
}
