package com.loandesk.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only log entry of a contract entering a stage. Rows are never updated or deleted.
 */
@Entity
@Table(name = "contract_stage_history")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ContractStageHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "contract_id", nullable = false, updatable = false)
    private UUID contractId;

    /**
     * {@code null} for the entry written at contract creation.
     */
    @Column(name = "from_stage_id", updatable = false)
    private UUID fromStageId;

    @Column(name = "to_stage_id", nullable = false, updatable = false)
    private UUID toStageId;

    @Column(name = "changed_by", nullable = false, updatable = false)
    private UUID changedBy;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb", updatable = false)
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
