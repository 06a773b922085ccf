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
 * One loan application.
 * <p>
 * {@code currentStageId} is the cursor of the workflow state machine; it only changes through a
 * validated transition, and every change is mirrored by a {@link ContractStageHistory} row.
 * </p>
 */
@Entity
@Table(name = "contract")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Contract {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Format HD-YYYY-NNNNNN, sequential per calendar year.
     */
    @Column(name = "contract_number", nullable = false, unique = true, length = 20)
    private String contractNumber;

    /**
     * Beneficiary and owner of the loan.
     */
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    /**
     * Agent who opened the contract on the owner's behalf; {@code null} when the owner did it.
     */
    @Column(name = "creator_id")
    private UUID creatorId;

    @Column(name = "service_id", nullable = false)
    private UUID serviceId;

    @Column(name = "current_stage_id", nullable = false)
    private UUID currentStageId;

    @Column(name = "requested_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal requestedAmount;

    @Column(name = "disbursed_amount", precision = 15, scale = 2)
    private BigDecimal disbursedAmount;

    /**
     * Percentage in (0, 100] of the disbursed amount kept as revenue.
     */
    @Column(name = "revenue_percentage", precision = 5, scale = 2)
    private BigDecimal revenuePercentage;

    /**
     * disbursedAmount * revenuePercentage / 100.
     */
    @Column(name = "total_revenue", precision = 15, scale = 2)
    private BigDecimal totalRevenue;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isOwnedOrCreatedBy(UUID actorId) {
        return actorId != null && (actorId.equals(userId) || actorId.equals(creatorId));
    }
}
