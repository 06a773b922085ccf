package com.loandesk.dto;

import com.loandesk.model.WorkflowStage;
import com.loandesk.model.WorkflowTransition;

public record AvailableTransition(WorkflowTransition transition, WorkflowStage toStage) {
}
