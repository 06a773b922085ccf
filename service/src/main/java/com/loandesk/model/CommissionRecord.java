package com.loandesk.model;

import com.loandesk.api.model.CommissionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Referral commission owed for one contract.
 * <p>
 * {@code contract_id} is unique: a contract produces at most one commission no matter how often
 * its commission stage is entered.
 * </p>
 */
@Entity
@Table(name = "commission_record")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class CommissionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * The referrer who earns the commission.
     */
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "contract_id", nullable = false, unique = true)
    private UUID contractId;

    /**
     * Owner of the contract, referred by {@link #userId}.
     */
    @Column(name = "referred_user_id", nullable = false)
    private UUID referredUserId;

    @Column(name = "amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "rate", nullable = false, precision = 5, scale = 4)
    private BigDecimal rate;

    @Column(name = "disbursement_amount", precision = 15, scale = 2)
    private BigDecimal disbursementAmount;

    @Column(name = "revenue_percentage", precision = 5, scale = 2)
    private BigDecimal revenuePercentage;

    @Column(name = "total_revenue", precision = 15, scale = 2)
    private BigDecimal totalRevenue;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CommissionStatus status;

    @Column(name = "credited_at")
    private LocalDateTime creditedAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
