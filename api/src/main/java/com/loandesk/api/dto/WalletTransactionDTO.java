package com.loandesk.api.dto;

import com.loandesk.api.model.TransactionType;
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
public class WalletTransactionDTO {
    private UUID id;
    private UUID walletId;
    private TransactionType type;
    private BigDecimal amount;
    private UUID referenceId;
    private String referenceType;
    private String description;
    private Map<String, Object> metadata;
    private LocalDateTime createdAt;
}
