package com.loandesk.api.model;

public enum WithdrawalMethod {
    BANKING,
    CRYPTO
}
