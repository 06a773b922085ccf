package com.loandesk.api.dto;

import com.loandesk.api.model.CommissionStatus;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class CommissionRecordDTO {
    private UUID id;
    private UUID userId;
    private UUID contractId;
    private UUID referredUserId;
    private BigDecimal amount;
    private BigDecimal rate;
    private BigDecimal disbursementAmount;
    private BigDecimal revenuePercentage;
    private BigDecimal totalRevenue;
    private CommissionStatus status;
    private LocalDateTime creditedAt;
    private LocalDateTime createdAt;
}
