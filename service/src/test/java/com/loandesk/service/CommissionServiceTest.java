package com.loandesk.service;

import com.loandesk.api.model.CommissionStatus;
import com.loandesk.api.request.CreateCommissionConfigRequest;
import com.loandesk.dto.ReferrerRate;
import com.loandesk.error.ResourceConflictException;
import com.loandesk.model.CommissionConfig;
import com.loandesk.model.CommissionRecord;
import com.loandesk.model.UserAccount;
import com.loandesk.model.Wallet;
import com.loandesk.repository.CommissionConfigRepository;
import com.loandesk.repository.CommissionRecordRepository;
import com.loandesk.repository.UserAccountRepository;
import com.loandesk.repository.WalletTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommissionServiceTest {

    private static final UUID CONTRACT = UUID.randomUUID();
    private static final UUID OWNER = UUID.randomUUID();
    private static final UUID REFERRER = UUID.randomUUID();

    @Mock
    private CommissionConfigRepository configRepository;
    @Mock
    private CommissionRecordRepository recordRepository;
    @Mock
    private UserAccountRepository userAccountRepository;
    @Mock
    private WalletTransactionRepository walletTransactionRepository;
    @Mock
    private WalletService walletService;
    @Mock
    private RbacService rbacService;
    @Mock
    private AuditService auditService;

    @InjectMocks
    private CommissionService commissionService;

    @BeforeEach
    void setUp() {
        lenient().when(recordRepository.save(any(CommissionRecord.class))).thenAnswer(inv -> {
            CommissionRecord record = inv.getArgument(0);
            if (record.getId() == null) {
                record.setId(UUID.randomUUID());
            }
            return record;
        });
    }

    @Test
    void referrerEarnsShareOfRevenue() {
        givenOwnerReferredBy(REFERRER);
        when(rbacService.hasRole(REFERRER, RbacService.ROLE_CTV)).thenReturn(true);
        when(configRepository.findByRoleCodeAndActiveTrue(RbacService.ROLE_CTV))
                .thenReturn(Optional.of(config(RbacService.ROLE_CTV, "0.1")));
        Wallet wallet = new Wallet();
        wallet.setId(UUID.randomUUID());
        when(walletService.getOrCreateWallet(REFERRER)).thenReturn(wallet);

        CommissionRecord record = commissionService.processContractCompletion(CONTRACT, OWNER,
                new BigDecimal("10000000"), new BigDecimal("5"), new BigDecimal("500000.00"));

        assertThat(record.getUserId()).isEqualTo(REFERRER);
        assertThat(record.getReferredUserId()).isEqualTo(OWNER);
        assertThat(record.getAmount()).isEqualByComparingTo("50000.00");
        assertThat(record.getStatus()).isEqualTo(CommissionStatus.CREDITED);
        assertThat(record.getCreditedAt()).isNotNull();
        verify(walletService).credit(eq(wallet.getId()), eq(new BigDecimal("50000.00")), eq(record.getId()),
                eq(WalletService.REF_COMMISSION), anyString(), anyMap());
    }

    @Test
    void secondCompletionOfSameContractPaysNothing() {
        givenOwnerReferredBy(REFERRER);
        when(recordRepository.existsByContractId(CONTRACT)).thenReturn(true);

        CommissionRecord record = commissionService.processContractCompletion(CONTRACT, OWNER,
                new BigDecimal("10000000"), new BigDecimal("5"), new BigDecimal("500000.00"));

        assertThat(record).isNull();
        verify(recordRepository, never()).save(any());
        verify(walletService, never()).credit(any(), any(), any(), any(), any(), any());
    }

    @Test
    void ownerWithoutReferrerPaysNothing() {
        givenOwnerReferredBy(null);

        assertThat(commissionService.processContractCompletion(CONTRACT, OWNER, BigDecimal.TEN, BigDecimal.ONE,
                new BigDecimal("0.10"))).isNull();
        verify(recordRepository, never()).save(any());
    }

    @Test
    void zeroRateCreatesNoRecord() {
        givenOwnerReferredBy(REFERRER);
        when(rbacService.hasRole(REFERRER, RbacService.ROLE_CTV)).thenReturn(false);
        when(configRepository.findByRoleCodeAndActiveTrue(RbacService.ROLE_USER)).thenReturn(Optional.empty());

        assertThat(commissionService.processContractCompletion(CONTRACT, OWNER, BigDecimal.TEN, BigDecimal.ONE,
                new BigDecimal("0.10"))).isNull();
        verify(recordRepository, never()).save(any());
    }

    @Test
    void agentWithoutAgentConfigFallsBackToUserRate() {
        when(rbacService.hasRole(REFERRER, RbacService.ROLE_CTV)).thenReturn(true);
        when(configRepository.findByRoleCodeAndActiveTrue(RbacService.ROLE_CTV)).thenReturn(Optional.empty());
        when(configRepository.findByRoleCodeAndActiveTrue(RbacService.ROLE_USER))
                .thenReturn(Optional.of(config(RbacService.ROLE_USER, "0.05")));

        ReferrerRate rate = commissionService.getReferrerCommissionRate(REFERRER);

        assertThat(rate.roleCode()).isEqualTo(RbacService.ROLE_USER);
        assertThat(rate.rate()).isEqualByComparingTo("0.05");
    }

    @Test
    void secondActiveConfigForRoleIsRejected() {
        when(configRepository.existsByRoleCodeAndActiveTrue("CTV")).thenReturn(true);

        assertThatThrownBy(() -> commissionService.createConfig(
                new CreateCommissionConfigRequest(" ctv ", new BigDecimal("0.1")), UUID.randomUUID()))
                .isInstanceOf(ResourceConflictException.class)
                .hasMessage("Active commission config already exists for this role");
        verify(configRepository, never()).save(any());
    }

    @Test
    void monthBoundsCoverWholeMonth() {
        YearMonth february = YearMonth.of(2024, 2);

        assertThat(CommissionService.monthStart(february)).isEqualTo(LocalDateTime.of(2024, 2, 1, 0, 0));
        assertThat(CommissionService.nextMonthStart(february)).isEqualTo(LocalDateTime.of(2024, 3, 1, 0, 0));
    }

    @Test
    void lastInstantOfMonthFallsInThatMonthOnly() {
        YearMonth january = YearMonth.of(2026, 1);
        YearMonth february = YearMonth.of(2026, 2);
        LocalDateTime lastMicros = LocalDateTime.of(2026, 1, 31, 23, 59, 59, 999_500_000);

        assertThat(inWindow(lastMicros, january)).isTrue();
        assertThat(inWindow(lastMicros, february)).isFalse();
        assertThat(inWindow(LocalDateTime.of(2026, 2, 1, 0, 0), january)).isFalse();
        assertThat(inWindow(LocalDateTime.of(2026, 2, 1, 0, 0), february)).isTrue();
    }

    private static boolean inWindow(LocalDateTime createdAt, YearMonth month) {
        return !createdAt.isBefore(CommissionService.monthStart(month))
                && createdAt.isBefore(CommissionService.nextMonthStart(month));
    }

    private void givenOwnerReferredBy(UUID referrerId) {
        UserAccount owner = new UserAccount();
        owner.setId(OWNER);
        owner.setReferredBy(referrerId);
        when(userAccountRepository.findById(OWNER)).thenReturn(Optional.of(owner));
    }

    private static CommissionConfig config(String roleCode, String rate) {
        CommissionConfig config = new CommissionConfig();
        config.setId(UUID.randomUUID());
        config.setRoleCode(roleCode);
        config.setRate(new BigDecimal(rate));
        return config;
    }
}
