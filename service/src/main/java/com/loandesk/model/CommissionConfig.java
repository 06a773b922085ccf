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
 * Referral commission rate of a role. At most one active config per role.
 */
@Entity
@Table(name = "commission_config")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class CommissionConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "role_code", nullable = false, length = 50)
    private String roleCode;

    /**
     * Fraction in [0, 1] of the contract revenue, e.g. 0.05.
     */
    @Column(name = "rate", nullable = false, precision = 5, scale = 4)
    private BigDecimal rate;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
