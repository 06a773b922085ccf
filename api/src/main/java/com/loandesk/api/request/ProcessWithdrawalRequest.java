package com.loandesk.api.request;

import com.loandesk.api.model.WithdrawalStatus;
import jakarta.validation.constraints.NotNull;

public record ProcessWithdrawalRequest(
        @NotNull(message = "Target status is required")
        WithdrawalStatus status,

        String adminNote,

        String proofFileUrl
) {
}
