package com.loandesk.api.dto;

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
public class CommissionConfigDTO {
    private UUID id;
    private String roleCode;
    private BigDecimal rate;
    private boolean active;
    private LocalDateTime updatedAt;
}
