package com.loandesk.api.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class StageHistoryDTO {
    private UUID id;
    private UUID contractId;
    private UUID fromStageId;
    private UUID toStageId;
    private UUID changedBy;
    private Map<String, Object> metadata;
    private LocalDateTime createdAt;
}
