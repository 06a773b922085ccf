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
 * A loan "service" users can apply for.
 */
@Entity
@Table(name = "loan_service")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class LoanProduct {

    public static final BigDecimal DEFAULT_MIN_LOAN_AMOUNT = new BigDecimal("1000000");
    public static final BigDecimal DEFAULT_MAX_LOAN_AMOUNT = new BigDecimal("100000000");

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    private String description;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "min_loan_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal minLoanAmount = DEFAULT_MIN_LOAN_AMOUNT;

    @Column(name = "max_loan_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal maxLoanAmount = DEFAULT_MAX_LOAN_AMOUNT;

    @Column(name = "commission_enabled", nullable = false)
    private boolean commissionEnabled = true;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
