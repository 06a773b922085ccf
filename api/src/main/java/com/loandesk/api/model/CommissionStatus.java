package com.loandesk.api.model;

/**
 * Lifecycle of a single referral commission.
 * <p>
 * A record is written as PENDING and moves to CREDITED once the referrer's wallet has been credited
 * inside the same transaction, so a committed PENDING record indicates an interrupted payout.
 * </p>
 */
public enum CommissionStatus {
    PENDING,
    CREDITED
}
