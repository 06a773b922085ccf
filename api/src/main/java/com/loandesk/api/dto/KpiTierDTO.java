package com.loandesk.api.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * KPI bonus bracket. Exactly one of {@code bonusRate} and {@code bonusAmount} is set.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class KpiTierDTO {
    private UUID id;
    private String name;
    private String roleCode;
    private Integer minContracts;
    private BigDecimal minDisbursement;
    private BigDecimal bonusRate;
    private BigDecimal bonusAmount;
    private Integer tierOrder;
    private boolean active;
}
