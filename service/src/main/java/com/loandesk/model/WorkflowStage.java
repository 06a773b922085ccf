package com.loandesk.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A node of a workflow. A contract occupies exactly one stage at a time.
 */
@Entity
@Table(name = "workflow_stage")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class WorkflowStage {

    public static final String DEFAULT_COLOR = "#6B7280";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    /**
     * Unique within the workflow, e.g. DRAFT, SUBMITTED, COMPLETED.
     */
    @Column(name = "code", nullable = false, length = 50)
    private String code;

    @Column(name = "name", nullable = false)
    private String name;

    /**
     * Position in the default linear sequence. The lowest order is the initial stage.
     */
    @Column(name = "stage_order", nullable = false)
    private Integer stageOrder;

    @Column(name = "color", nullable = false, length = 20)
    private String color = DEFAULT_COLOR;

    @Column(name = "is_required", nullable = false)
    private boolean required;

    /**
     * Entering this stage fires commission processing for the contract's referrer.
     */
    @Column(name = "triggers_commission", nullable = false)
    private boolean triggersCommission;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
