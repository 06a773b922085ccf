package com.loandesk.api.response;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Result of comparing a wallet's cached balance with the sum of its ledger.
 *
 * @param valid          {@code true} when both balances are equal
 * @param storedBalance  balance column of the wallet
 * @param derivedBalance sum of CREDIT minus sum of DEBIT entries
 */
public record IntegrityResponse(
        UUID walletId,
        boolean valid,
        BigDecimal storedBalance,
        BigDecimal derivedBalance
) {}
