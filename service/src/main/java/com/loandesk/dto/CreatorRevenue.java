package com.loandesk.dto;

import java.math.BigDecimal;
import java.util.UUID;

public record CreatorRevenue(UUID creatorId, Long contractCount, BigDecimal totalDisbursed, BigDecimal totalRevenue) {
}
