package com.loandesk.api.response;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Response for wallet balance query.
 */
public record BalanceResponse(
        UUID userId,
        UUID walletId,
        BigDecimal balance
) {}
