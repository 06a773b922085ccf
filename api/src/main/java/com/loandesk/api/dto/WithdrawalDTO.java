package com.loandesk.api.dto;

import com.loandesk.api.model.WithdrawalMethod;
import com.loandesk.api.model.WithdrawalStatus;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class WithdrawalDTO {
    private UUID id;
    private UUID userId;
    private BigDecimal amount;
    private WithdrawalMethod method;
    private Map<String, Object> accountInfo;
    private WithdrawalStatus status;
    private String adminNote;
    private String proofFileUrl;
    private UUID processedBy;
    private LocalDateTime processedAt;
    private LocalDateTime createdAt;
}
