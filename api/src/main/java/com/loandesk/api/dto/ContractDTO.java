package com.loandesk.api.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Loan contract as seen by API consumers.
 * <p>
 * {@code documents} and {@code answers} are only filled for single-contract reads; list endpoints
 * leave them {@code null}.
 * </p>
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class ContractDTO {
    private UUID id;
    private String contractNumber;
    private UUID userId;
    private UUID creatorId;
    private UUID serviceId;
    private UUID currentStageId;
    private StageDTO currentStage;
    private BigDecimal requestedAmount;
    private BigDecimal disbursedAmount;
    private BigDecimal revenuePercentage;
    private BigDecimal totalRevenue;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private List<ContractDocumentDTO> documents;
    private List<ContractAnswerDTO> answers;
}
