package com.loandesk.api.response;

import java.math.BigDecimal;
import java.util.UUID;

public record CreatorRevenueResponse(
        UUID creatorId,
        long contractCount,
        BigDecimal totalDisbursed,
        BigDecimal totalRevenue
) {}
