package com.loandesk.api.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class ContractAnswerDTO {
    private UUID id;
    private UUID contractId;
    private UUID questionId;
    private String answer;
    private LocalDateTime updatedAt;
}
