package com.loandesk.api.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * A directed edge of a workflow. {@code toStage} is populated when the transition is listed
 * as an available move for a contract.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class TransitionDTO {
    private UUID id;
    private UUID workflowId;
    private UUID fromStageId;
    private UUID toStageId;
    private String requiredPermission;
    private StageDTO toStage;
}
