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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommissionSnapshotServiceTest {

    private static final UUID USER = UUID.randomUUID();

    @Mock
    private CommissionSnapshotRepository snapshotRepository;
    @Mock
    private CommissionRecordRepository recordRepository;
    @Mock
    private UserAccountRepository userAccountRepository;
    @Mock
    private KpiTierService kpiTierService;
    @Mock
    private WalletService walletService;
    @Mock
    private RbacService rbacService;
    @Mock
    private SystemConfigService systemConfigService;
    @Mock
    private AuditService auditService;

    @InjectMocks
    private CommissionSnapshotService snapshotService;

    @BeforeEach
    void setUp() {
        lenient().when(snapshotRepository.save(any(CommissionSnapshot.class))).thenAnswer(inv -> {
            CommissionSnapshot snapshot = inv.getArgument(0);
            if (snapshot.getId() == null) {
                snapshot.setId(UUID.randomUUID());
            }
            return snapshot;
        });
    }

    @Test
    void existingSnapshotIsReturnedUnchanged() {
        CommissionSnapshot existing = snapshot(SnapshotStatus.PAID, BigDecimal.ZERO);
        when(snapshotRepository.findByUserIdAndPeriodYearAndPeriodMonth(USER, 2025, 3))
                .thenReturn(Optional.of(existing));

        assertThat(snapshotService.createMonthlySnapshot(USER, 2025, 3)).isSameAs(existing);
        verify(snapshotRepository, never()).save(any());
    }

    @Test
    void snapshotSumsCreditedRecordsAndAddsKpiBonus() {
        when(userAccountRepository.existsById(USER)).thenReturn(true);
        when(recordRepository.findByUserIdAndStatusCreatedInRange(USER, CommissionStatus.CREDITED,
                LocalDateTime.of(2025, 3, 1, 0, 0), LocalDateTime.of(2025, 4, 1, 0, 0))).thenReturn(List.of(
                record("10000000", "50000.00"),
                record("20000000", "100000.00")));
        when(rbacService.hasRole(USER, RbacService.ROLE_CTV)).thenReturn(true);
        when(systemConfigService.isKpiEvaluationEnabled()).thenReturn(true);
        KpiCommissionTier silver = new KpiCommissionTier();
        silver.setId(UUID.randomUUID());
        silver.setName("Silver");
        when(kpiTierService.calculateKpiTier(RbacService.ROLE_CTV, 2, new BigDecimal("30000000")))
                .thenReturn(new KpiTierResult(silver, new BigDecimal("300000.00")));

        CommissionSnapshot snapshot = snapshotService.createMonthlySnapshot(USER, 2025, 3);

        assertThat(snapshot.getStatus()).isEqualTo(SnapshotStatus.PENDING);
        assertThat(snapshot.getTotalContracts()).isEqualTo(2);
        assertThat(snapshot.getBaseCommission()).isEqualByComparingTo("150000.00");
        assertThat(snapshot.getBonusCommission()).isEqualByComparingTo("300000.00");
        assertThat(snapshot.getTotalCommission()).isEqualByComparingTo("450000.00");
        assertThat(snapshot.getKpiTierId()).isEqualTo(silver.getId());
    }

    @Test
    void disabledKpiEvaluationGivesNoBonus() {
        when(userAccountRepository.existsById(USER)).thenReturn(true);
        when(recordRepository.findByUserIdAndStatusCreatedInRange(eq(USER), eq(CommissionStatus.CREDITED),
                any(), any())).thenReturn(List.of());
        when(systemConfigService.isKpiEvaluationEnabled()).thenReturn(false);

        CommissionSnapshot snapshot = snapshotService.createMonthlySnapshot(USER, 2025, 3);

        assertThat(snapshot.getKpiTierId()).isNull();
        assertThat(snapshot.getTotalCommission()).isEqualByComparingTo(BigDecimal.ZERO);
        verify(kpiTierService, never()).calculateKpiTier(any(), any(Long.class), any());
    }

    @Test
    void bonusIsCreditedOnce() {
        CommissionSnapshot snapshot = snapshot(SnapshotStatus.PENDING, new BigDecimal("300000.00"));
        KpiCommissionTier silver = new KpiCommissionTier();
        silver.setName("Silver");
        snapshot.setKpiTierId(UUID.randomUUID());
        Wallet wallet = new Wallet();
        wallet.setId(UUID.randomUUID());
        when(snapshotRepository.findById(snapshot.getId())).thenReturn(Optional.of(snapshot));
        when(kpiTierService.getTier(snapshot.getKpiTierId())).thenReturn(silver);
        when(walletService.getOrCreateWallet(USER)).thenReturn(wallet);

        CommissionSnapshot processed = snapshotService.processSnapshotBonus(snapshot.getId(), UUID.randomUUID());

        assertThat(processed.getStatus()).isEqualTo(SnapshotStatus.PROCESSED);
        assertThat(processed.getProcessedAt()).isNotNull();
        verify(walletService).credit(eq(wallet.getId()), eq(new BigDecimal("300000.00")), eq(snapshot.getId()),
                eq(WalletService.REF_KPI_BONUS), eq("KPI bonus 3/2025 - Silver"), anyMap());

        assertThatThrownBy(() -> snapshotService.processSnapshotBonus(snapshot.getId(), UUID.randomUUID()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Snapshot has already been processed");
    }

    @Test
    void zeroBonusIsProcessedWithoutCredit() {
        CommissionSnapshot snapshot = snapshot(SnapshotStatus.PENDING, BigDecimal.ZERO);
        when(snapshotRepository.findById(snapshot.getId())).thenReturn(Optional.of(snapshot));

        CommissionSnapshot processed = snapshotService.processSnapshotBonus(snapshot.getId(), UUID.randomUUID());

        assertThat(processed.getStatus()).isEqualTo(SnapshotStatus.PROCESSED);
        verify(walletService, never()).credit(any(), any(), any(), any(), any(), any());
    }

    @Test
    void onlyProcessedSnapshotCanBePaid() {
        CommissionSnapshot snapshot = snapshot(SnapshotStatus.PENDING, BigDecimal.ZERO);
        when(snapshotRepository.findById(snapshot.getId())).thenReturn(Optional.of(snapshot));

        assertThatThrownBy(() -> snapshotService.markSnapshotPaid(snapshot.getId(), UUID.randomUUID()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Only processed snapshots can be marked as paid");

        snapshot.setStatus(SnapshotStatus.PROCESSED);
        assertThat(snapshotService.markSnapshotPaid(snapshot.getId(), UUID.randomUUID()).getStatus())
                .isEqualTo(SnapshotStatus.PAID);
    }

    private static CommissionSnapshot snapshot(SnapshotStatus status, BigDecimal bonus) {
        CommissionSnapshot snapshot = new CommissionSnapshot();
        snapshot.setId(UUID.randomUUID());
        snapshot.setUserId(USER);
        snapshot.setPeriodYear(2025);
        snapshot.setPeriodMonth(3);
        snapshot.setBonusCommission(bonus);
        snapshot.setStatus(status);
        return snapshot;
    }

    private static CommissionRecord record(String disbursement, String amount) {
        CommissionRecord record = new CommissionRecord();
        record.setId(UUID.randomUUID());
        record.setUserId(USER);
        record.setDisbursementAmount(new BigDecimal(disbursement));
        record.setAmount(new BigDecimal(amount));
        record.setStatus(CommissionStatus.CREDITED);
        return record;
    }
}
