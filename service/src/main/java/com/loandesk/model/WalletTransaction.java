package com.loandesk.model;

import com.loandesk.api.model.TransactionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable ledger entry of a wallet.
 *
 * <p>Amounts are always positive; the direction is carried by {@link #type}. Entries are
 * append-only, corrections are made with an offsetting entry (e.g. a withdrawal refund).
 *
 * <p>{@code referenceType}/{@code referenceId} link the entry to what caused it:
 * {@code commission} (commission record), {@code kpi_bonus} (snapshot),
 * {@code withdrawal_hold} and {@code withdrawal_refund} (withdrawal request).
 */
@Entity
@Table(name = "wallet_transaction")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class WalletTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "wallet_id", nullable = false, updatable = false)
    private UUID walletId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 10, updatable = false)
    private TransactionType type;

    @Column(name = "amount", nullable = false, precision = 15, scale = 2, updatable = false)
    private BigDecimal amount;

    @Column(name = "reference_id", updatable = false)
    private UUID referenceId;

    @Column(name = "reference_type", length = 50, updatable = false)
    private String referenceType;

    @Column(name = "description", length = 500, updatable = false)
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb", updatable = false)
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
