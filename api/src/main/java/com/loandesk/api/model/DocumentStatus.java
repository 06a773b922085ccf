package com.loandesk.api.model;

public enum DocumentStatus {
    PENDING,
    APPROVED,
    REJECTED
}
