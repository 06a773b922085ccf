package com.loandesk.model;

import com.loandesk.api.model.SnapshotStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Monthly rollup of a user's credited commissions. Unique per (user, year, month).
 */
@Entity
@Table(name = "commission_snapshot")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class CommissionSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "period_year", nullable = false)
    private Integer periodYear;

    @Column(name = "period_month", nullable = false)
    private Integer periodMonth;

    @Column(name = "total_contracts", nullable = false)
    private Integer totalContracts;

    @Column(name = "total_disbursement", nullable = false, precision = 15, scale = 2)
    private BigDecimal totalDisbursement;

    @Column(name = "base_commission", nullable = false, precision = 15, scale = 2)
    private BigDecimal baseCommission;

    @Column(name = "kpi_tier_id")
    private UUID kpiTierId;

    @Column(name = "bonus_commission", nullable = false, precision = 15, scale = 2)
    private BigDecimal bonusCommission;

    @Column(name = "total_commission", nullable = false, precision = 15, scale = 2)
    private BigDecimal totalCommission;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SnapshotStatus status;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
