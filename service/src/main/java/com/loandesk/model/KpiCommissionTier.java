package com.loandesk.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Monthly KPI bonus bracket of a role.
 * <p>
 * Tiers are evaluated by descending {@code tierOrder}; a missing threshold counts as met.
 * Exactly one of {@code bonusRate} and {@code bonusAmount} is set ({@code chk_kpi_single_reward}).
 * </p>
 */
@Entity
@Table(name = "kpi_commission_tier")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class KpiCommissionTier {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "role_code", nullable = false, length = 50)
    private String roleCode;

    @Column(name = "min_contracts")
    private Integer minContracts;

    @Column(name = "min_disbursement", precision = 15, scale = 2)
    private BigDecimal minDisbursement;

    @Column(name = "bonus_rate", precision = 5, scale = 4)
    private BigDecimal bonusRate;

    @Column(name = "bonus_amount", precision = 15, scale = 2)
    private BigDecimal bonusAmount;

    @Column(name = "tier_order", nullable = false)
    private Integer tierOrder;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isSatisfiedBy(long totalContracts, BigDecimal totalDisbursement) {
        if (minContracts != null && totalContracts < minContracts) {
            return false;
        }
        return minDisbursement == null || totalDisbursement.compareTo(minDisbursement) >= 0;
    }

    public KpiReward reward() {
        if (bonusRate != null) {
            return new KpiReward.Rate(bonusRate);
        }
        if (bonusAmount != null) {
            return new KpiReward.FixedAmount(bonusAmount);
        }
        throw new IllegalStateException("KPI tier " + id + " defines no reward");
    }
}
