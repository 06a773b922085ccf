package com.loandesk.api.dto;

import com.loandesk.api.model.SnapshotStatus;
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
public class CommissionSnapshotDTO {
    private UUID id;
    private UUID userId;
    private Integer periodYear;
    private Integer periodMonth;
    private Integer totalContracts;
    private BigDecimal totalDisbursement;
    private BigDecimal baseCommission;
    private UUID kpiTierId;
    private BigDecimal bonusCommission;
    private BigDecimal totalCommission;
    private SnapshotStatus status;
    private LocalDateTime processedAt;
    private LocalDateTime createdAt;
}
