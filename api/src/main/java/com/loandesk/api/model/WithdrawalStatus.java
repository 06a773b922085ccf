package com.loandesk.api.model;

public enum WithdrawalStatus {
    PENDING,
    APPROVED,
    PAID,
    REJECTED
}
