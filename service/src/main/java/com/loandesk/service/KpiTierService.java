package com.loandesk.service;

import com.loandesk.api.request.KpiTierRequest;
import com.loandesk.dto.KpiTierResult;
import com.loandesk.model.KpiCommissionTier;
import com.loandesk.repository.CommissionSnapshotRepository;
import com.loandesk.repository.KpiCommissionTierRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Monthly KPI tiers and their evaluation.
 */
@Service
@Validated
@AllArgsConstructor
@Slf4j
public class KpiTierService {

    private final KpiCommissionTierRepository tierRepository;
    private final CommissionSnapshotRepository snapshotRepository;
    private final AuditService auditService;

    @Transactional
    public KpiCommissionTier createTier(@Valid @NotNull KpiTierRequest request, @NotNull UUID adminId) {
        KpiCommissionTier tier = new KpiCommissionTier();
        tier.setCreatedAt(LocalDateTime.now());
        apply(tier, request);
        tier = tierRepository.save(tier);

        auditService.log(adminId, "KPI_TIER_CREATED", AuditService.TARGET_KPI_TIER, tier.getId(),
                Map.of("name", tier.getName(), "roleCode", tier.getRoleCode()));
        log.info("Created KPI tier: id={}, name={}, role={}, order={}",
                tier.getId(), tier.getName(), tier.getRoleCode(), tier.getTierOrder());
        return tier;
    }

    @Transactional
    public KpiCommissionTier updateTier(@NotNull UUID tierId, @Valid @NotNull KpiTierRequest request,
                                        @NotNull UUID adminId) {
        KpiCommissionTier tier = getTier(tierId);
        apply(tier, request);
        tier = tierRepository.save(tier);

        auditService.log(adminId, "KPI_TIER_UPDATED", AuditService.TARGET_KPI_TIER, tierId,
                Map.of("name", tier.getName(), "roleCode", tier.getRoleCode()));
        log.info("Updated KPI tier: id={}, name={}", tierId, tier.getName());
        return tier;
    }

    /**
     * @throws IllegalArgumentException if a snapshot references the tier
     */
    @Transactional
    public void deleteTier(@NotNull UUID tierId, @NotNull UUID adminId) {
        KpiCommissionTier tier = getTier(tierId);
        if (snapshotRepository.existsByKpiTierId(tierId)) {
            throw new IllegalArgumentException("Cannot delete KPI tier that has been used in snapshots");
        }
        tierRepository.delete(tier);

        auditService.log(adminId, "KPI_TIER_DELETED", AuditService.TARGET_KPI_TIER, tierId,
                Map.of("name", tier.getName(), "roleCode", tier.getRoleCode()));
        log.info("Deleted KPI tier: id={}, name={}", tierId, tier.getName());
    }

    public KpiCommissionTier getTier(@NotNull UUID tierId) {
        return tierRepository.findById(tierId)
                .orElseThrow(() -> new EntityNotFoundException("KPI tier not found"));
    }

    public List<KpiCommissionTier> listTiers(String roleCode) {
        return roleCode == null || roleCode.isBlank()
                ? tierRepository.findAllByOrderByRoleCodeAscTierOrderAsc()
                : tierRepository.findByRoleCodeOrderByTierOrderAsc(roleCode.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Picks the highest active tier of the role whose thresholds the month's figures meet.
     *
     * @return the tier and its bonus, or {@link KpiTierResult#none()} when no tier is reached
     */
    public KpiTierResult calculateKpiTier(@NotNull String roleCode, long totalContracts,
                                         @NotNull BigDecimal totalDisbursement) {
        for (KpiCommissionTier tier : tierRepository.findByRoleCodeAndActiveTrueOrderByTierOrderDesc(roleCode)) {
            if (tier.isSatisfiedBy(totalContracts, totalDisbursement)) {
                return new KpiTierResult(tier, tier.reward().bonusFor(totalDisbursement));
            }
        }
        return KpiTierResult.none();
    }

    private static void apply(KpiCommissionTier tier, KpiTierRequest request) {
        if ((request.bonusRate() == null) == (request.bonusAmount() == null)) {
            throw new IllegalArgumentException("Exactly one of bonus rate and bonus amount must be set");
        }
        tier.setName(request.name().trim());
        tier.setRoleCode(request.roleCode().trim().toUpperCase(Locale.ROOT));
        tier.setMinContracts(request.minContracts());
        tier.setMinDisbursement(request.minDisbursement());
        tier.setBonusRate(request.bonusRate());
        tier.setBonusAmount(request.bonusAmount());
        tier.setTierOrder(request.tierOrder());
        if (request.active() != null) {
            tier.setActive(request.active());
        }
        tier.setUpdatedAt(LocalDateTime.now());
    }
}
