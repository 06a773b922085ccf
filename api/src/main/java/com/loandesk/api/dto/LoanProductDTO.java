package com.loandesk.api.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class LoanProductDTO {
    private UUID id;
    private String name;
    private String description;
    private UUID workflowId;
    private BigDecimal minLoanAmount;
    private BigDecimal maxLoanAmount;
    private boolean commissionEnabled;
    private boolean active;
}
