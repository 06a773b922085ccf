package com.loandesk.dto;

import com.loandesk.model.Workflow;
import com.loandesk.model.WorkflowStage;
import com.loandesk.model.WorkflowTransition;

import java.util.List;

/**
 * A workflow together with its stages (ordered by stage order) and transitions.
 */
public record WorkflowGraph(Workflow workflow, List<WorkflowStage> stages, List<WorkflowTransition> transitions) {
}
