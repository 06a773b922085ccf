package com.loandesk.dto;

import com.loandesk.model.Contract;
import com.loandesk.model.ContractAnswer;
import com.loandesk.model.ContractDocument;
import com.loandesk.model.ContractFile;
import com.loandesk.model.WorkflowStage;

import java.util.List;

/**
 * A contract with everything its detail view shows.
 */
public record ContractDetails(
        Contract contract,
        WorkflowStage currentStage,
        List<ContractDocument> documents,
        List<ContractFile> files,
        List<ContractAnswer> answers
) {
}
