package com.loandesk.api.model;

/**
 * Direction of a wallet ledger entry.
 */
public enum TransactionType {
    CREDIT,
    DEBIT
}
