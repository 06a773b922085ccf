package com.loandesk.api.request;

import com.loandesk.api.model.WithdrawalMethod;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.util.Map;

/**
 * @param accountInfo destination details, e.g. bank name and account number or a wallet address
 */
public record CreateWithdrawalRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        @NotNull(message = "Withdrawal method is required")
        WithdrawalMethod method,

        @NotEmpty(message = "Account information is required")
        Map<String, Object> accountInfo
) {
}
