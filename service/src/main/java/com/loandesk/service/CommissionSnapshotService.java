package com.loandesk.service;

import com.loandesk.api.model.CommissionStatus;
import com.loandesk.api.model.SnapshotStatus;
import com.loandesk.dto.KpiTierResult;
import com.loandesk.model.CommissionRecord;
import com.loandesk.model.CommissionSnapshot;
import com.loandesk.model.KpiCommissionTier;
import com.loandesk.model.Wallet;
import com.loandesk.repository.CommissionRecordRepository;
import com.loandesk.repository.CommissionSnapshotRepository;
import com.loandesk.repository.UserAccountRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Monthly commission snapshots.
 *
 * <p>A snapshot freezes a user's credited commissions of one calendar month together with the KPI
 * tier reached. Its bonus is paid separately by an admin:
 * <pre>
 *   PENDING --processSnapshotBonus--> PROCESSED --markSnapshotPaid--> PAID
 * </pre>
 */
@Service
@Validated
@AllArgsConstructor
@Slf4j
public class CommissionSnapshotService {

    private final CommissionSnapshotRepository snapshotRepository;
    private final CommissionRecordRepository recordRepository;
    private final UserAccountRepository userAccountRepository;
    private final KpiTierService kpiTierService;
    private final WalletService walletService;
    private final RbacService rbacService;
    private final SystemConfigService systemConfigService;
    private final AuditService auditService;

    /**
     * Creates the snapshot of a user for a month, or returns the existing one.
     *
     * @throws EntityNotFoundException if the user does not exist
     */
    @Transactional
    public CommissionSnapshot createMonthlySnapshot(@NotNull UUID userId, int year, int month) {
        Optional<CommissionSnapshot> existing = snapshotRepository.findByUserIdAndPeriodYearAndPeriodMonth(userId,
                year, month);
        if (existing.isPresent()) {
            log.info("Snapshot already exists: userId={}, period={}-{}, snapshotId={}",
                    userId, year, month, existing.get().getId());
            return existing.get();
        }
        if (!userAccountRepository.existsById(userId)) {
            throw new EntityNotFoundException("User not found");
        }

        YearMonth period = YearMonth.of(year, month);
        List<CommissionRecord> records = recordRepository.findByUserIdAndStatusCreatedInRange(userId,
                CommissionStatus.CREDITED, CommissionService.monthStart(period), CommissionService.nextMonthStart(period));

        int totalContracts = records.size();
        BigDecimal totalDisbursement = records.stream()
                .map(CommissionRecord::getDisbursementAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal baseCommission = records.stream()
                .map(CommissionRecord::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        String roleCode = rbacService.hasRole(userId, RbacService.ROLE_CTV) ? RbacService.ROLE_CTV : RbacService.ROLE_USER;
        KpiTierResult kpi = systemConfigService.isKpiEvaluationEnabled()
                ? kpiTierService.calculateKpiTier(roleCode, totalContracts, totalDisbursement)
                : KpiTierResult.none();
        KpiCommissionTier tier = kpi.tier();

        CommissionSnapshot snapshot = new CommissionSnapshot();
        snapshot.setUserId(userId);
        snapshot.setPeriodYear(year);
        snapshot.setPeriodMonth(month);
        snapshot.setTotalContracts(totalContracts);
        snapshot.setTotalDisbursement(totalDisbursement);
        snapshot.setBaseCommission(baseCommission);
        snapshot.setKpiTierId(tier == null ? null : tier.getId());
        snapshot.setBonusCommission(kpi.bonus());
        snapshot.setTotalCommission(baseCommission.add(kpi.bonus()));
        snapshot.setStatus(SnapshotStatus.PENDING);
        snapshot.setCreatedAt(LocalDateTime.now());
        snapshot = snapshotRepository.save(snapshot);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("year", year);
        metadata.put("month", month);
        metadata.put("totalContracts", totalContracts);
        metadata.put("totalDisbursement", totalDisbursement);
        metadata.put("baseCommission", baseCommission);
        metadata.put("bonusCommission", kpi.bonus());
        metadata.put("kpiTier", tier == null ? null : tier.getName());
        auditService.log(userId, "COMMISSION_SNAPSHOT_CREATED", AuditService.TARGET_SNAPSHOT, snapshot.getId(), metadata);

        log.info("Created snapshot: id={}, userId={}, period={}-{}, contracts={}, base={}, bonus={}, tier={}",
                snapshot.getId(), userId, year, month, totalContracts, baseCommission, kpi.bonus(),
                tier == null ? null : tier.getName());
        return snapshot;
    }

    /**
     * Credits the KPI bonus of a PENDING snapshot and marks it PROCESSED.
     *
     * @throws IllegalStateException if the snapshot was processed already
     */
    @Transactional
    public CommissionSnapshot processSnapshotBonus(@NotNull UUID snapshotId, @NotNull UUID adminId) {
        CommissionSnapshot snapshot = getSnapshot(snapshotId);
        if (snapshot.getStatus() != SnapshotStatus.PENDING) {
            throw new IllegalStateException("Snapshot has already been processed");
        }

        BigDecimal bonus = snapshot.getBonusCommission();
        if (bonus != null && bonus.signum() > 0) {
            String tierName = snapshot.getKpiTierId() == null ? "" : kpiTierService.getTier(snapshot.getKpiTierId()).getName();
            Wallet wallet = walletService.getOrCreateWallet(snapshot.getUserId());
            walletService.credit(wallet.getId(), bonus, snapshot.getId(), WalletService.REF_KPI_BONUS,
                    String.format("KPI bonus %d/%d - %s", snapshot.getPeriodMonth(), snapshot.getPeriodYear(), tierName),
                    Map.of("year", snapshot.getPeriodYear(), "month", snapshot.getPeriodMonth()));
        }

        snapshot.setStatus(SnapshotStatus.PROCESSED);
        snapshot.setProcessedAt(LocalDateTime.now());
        snapshot = snapshotRepository.save(snapshot);

        auditService.log(adminId, "COMMISSION_BONUS_PROCESSED", AuditService.TARGET_SNAPSHOT, snapshotId,
                Map.of("userId", snapshot.getUserId(), "bonus", bonus == null ? BigDecimal.ZERO : bonus));
        log.info("Processed snapshot bonus: id={}, userId={}, bonus={}", snapshotId, snapshot.getUserId(), bonus);
        return snapshot;
    }

    /**
     * @throws IllegalStateException unless the snapshot is PROCESSED
     */
    @Transactional
    public CommissionSnapshot markSnapshotPaid(@NotNull UUID snapshotId, @NotNull UUID adminId) {
        CommissionSnapshot snapshot = getSnapshot(snapshotId);
        if (snapshot.getStatus() != SnapshotStatus.PROCESSED) {
            throw new IllegalStateException("Only processed snapshots can be marked as paid");
        }
        snapshot.setStatus(SnapshotStatus.PAID);
        snapshot = snapshotRepository.save(snapshot);

        auditService.log(adminId, "COMMISSION_SNAPSHOT_PAID", AuditService.TARGET_SNAPSHOT, snapshotId,
                Map.of("userId", snapshot.getUserId()));
        log.info("Marked snapshot paid: id={}", snapshotId);
        return snapshot;
    }

    public CommissionSnapshot getSnapshot(@NotNull UUID snapshotId) {
        return snapshotRepository.findById(snapshotId)
                .orElseThrow(() -> new EntityNotFoundException("Snapshot not found"));
    }

    public Page<CommissionSnapshot> getUserSnapshots(@NotNull UUID userId, Pageable pageable) {
        return snapshotRepository.findByUserIdOrderByPeriodYearDescPeriodMonthDesc(userId, pageable);
    }

    public Page<CommissionSnapshot> searchSnapshots(Integer year, Integer month, SnapshotStatus status,
                                                    Pageable pageable) {
        return snapshotRepository.search(year, month, status, pageable);
    }
}
