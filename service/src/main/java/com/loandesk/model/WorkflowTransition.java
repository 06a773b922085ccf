package com.loandesk.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Directed edge between two stages of the same workflow.
 * <p>
 * At most one transition exists per (workflow, from, to); enforced by {@code uq_transition_edge}.
 * </p>
 */
@Entity
@Table(name = "workflow_transition")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class WorkflowTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "from_stage_id", nullable = false)
    private UUID fromStageId;

    @Column(name = "to_stage_id", nullable = false)
    private UUID toStageId;

    /**
     * Permission code the actor must hold, {@code null} when the move is open to everybody.
     */
    @Column(name = "required_permission", length = 100)
    private String requiredPermission;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
