package com.loandesk.service;

import com.loandesk.api.request.KpiTierRequest;
import com.loandesk.dto.KpiTierResult;
import com.loandesk.model.KpiCommissionTier;
import com.loandesk.repository.CommissionSnapshotRepository;
import com.loandesk.repository.KpiCommissionTierRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KpiTierServiceTest {

    @Mock
    private KpiCommissionTierRepository tierRepository;
    @Mock
    private CommissionSnapshotRepository snapshotRepository;
    @Mock
    private AuditService auditService;

    @InjectMocks
    private KpiTierService kpiTierService;

    @Test
    void highestSatisfiedTierWins() {
        KpiCommissionTier gold = tier("Gold", 3, 20, null, new BigDecimal("0.02"), null);
        KpiCommissionTier silver = tier("Silver", 2, 10, null, new BigDecimal("0.01"), null);
        KpiCommissionTier bronze = tier("Bronze", 1, 0, null, null, new BigDecimal("100000"));
        when(tierRepository.findByRoleCodeAndActiveTrueOrderByTierOrderDesc("CTV"))
                .thenReturn(List.of(gold, silver, bronze));

        KpiTierResult result = kpiTierService.calculateKpiTier("CTV", 15, new BigDecimal("300000000"));

        assertThat(result.tier()).isSameAs(silver);
        assertThat(result.bonus()).isEqualByComparingTo("3000000.00");
    }

    @Test
    void fixedAmountTierPaysItsAmount() {
        KpiCommissionTier bronze = tier("Bronze", 1, 0, null, null, new BigDecimal("100000"));
        when(tierRepository.findByRoleCodeAndActiveTrueOrderByTierOrderDesc("CTV")).thenReturn(List.of(bronze));

        KpiTierResult result = kpiTierService.calculateKpiTier("CTV", 1, BigDecimal.ZERO);

        assertThat(result.tier()).isSameAs(bronze);
        assertThat(result.bonus()).isEqualByComparingTo("100000.00");
    }

    @Test
    void disbursementThresholdMustAlsoBeMet() {
        KpiCommissionTier silver = tier("Silver", 2, 10, new BigDecimal("500000000"), new BigDecimal("0.01"), null);
        when(tierRepository.findByRoleCodeAndActiveTrueOrderByTierOrderDesc("USER")).thenReturn(List.of(silver));

        KpiTierResult result = kpiTierService.calculateKpiTier("USER", 15, new BigDecimal("300000000"));

        assertThat(result.tier()).isNull();
        assertThat(result.bonus()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void tierNeedsExactlyOneReward() {
        KpiTierRequest both = new KpiTierRequest("Gold", "CTV", 20, null, new BigDecimal("0.02"),
                new BigDecimal("100"), 3, true);
        KpiTierRequest neither = new KpiTierRequest("Gold", "CTV", 20, null, null, null, 3, true);

        assertThatThrownBy(() -> kpiTierService.createTier(both, UUID.randomUUID()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Exactly one of bonus rate and bonus amount must be set");
        assertThatThrownBy(() -> kpiTierService.createTier(neither, UUID.randomUUID()))
                .isInstanceOf(IllegalArgumentException.class);
        verify(tierRepository, never()).save(any());
    }

    @Test
    void createTierNormalizesRoleCode() {
        when(tierRepository.save(any(KpiCommissionTier.class))).thenAnswer(inv -> inv.getArgument(0));

        KpiCommissionTier tier = kpiTierService.createTier(new KpiTierRequest(" Gold ", "ctv", 20, null,
                new BigDecimal("0.02"), null, 3, null), UUID.randomUUID());

        assertThat(tier.getName()).isEqualTo("Gold");
        assertThat(tier.getRoleCode()).isEqualTo("CTV");
        assertThat(tier.isActive()).isTrue();
    }

    @Test
    void tierUsedBySnapshotCannotBeDeleted() {
        KpiCommissionTier gold = tier("Gold", 3, 20, null, new BigDecimal("0.02"), null);
        when(tierRepository.findById(gold.getId())).thenReturn(Optional.of(gold));
        when(snapshotRepository.existsByKpiTierId(gold.getId())).thenReturn(true);

        assertThatThrownBy(() -> kpiTierService.deleteTier(gold.getId(), UUID.randomUUID()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cannot delete KPI tier that has been used in snapshots");
        verify(tierRepository, never()).delete(any());
    }

    private static KpiCommissionTier tier(String name, int order, Integer minContracts, BigDecimal minDisbursement,
                                          BigDecimal bonusRate, BigDecimal bonusAmount) {
        KpiCommissionTier tier = new KpiCommissionTier();
        tier.setId(UUID.randomUUID());
        tier.setName(name);
        tier.setRoleCode("CTV");
        tier.setTierOrder(order);
        tier.setMinContracts(minContracts);
        tier.setMinDisbursement(minDisbursement);
        tier.setBonusRate(bonusRate);
        tier.setBonusAmount(bonusAmount);
        return tier;
    }
}
