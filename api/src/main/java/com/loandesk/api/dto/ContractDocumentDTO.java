package com.loandesk.api.dto;

import com.loandesk.api.model.DocumentStatus;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class ContractDocumentDTO {
    private UUID id;
    private UUID contractId;
    private UUID documentRequirementId;
    private DocumentStatus status;
    private String reviewNote;
    private UUID reviewedBy;
    private LocalDateTime reviewedAt;
    private List<ContractFileDTO> files;
}
