package com.loandesk.api.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class DocumentRequirementDTO {
    private UUID id;
    private String code;
    private String name;
    private String description;
    private Integer version;
    private Integer minFiles;
    private Integer maxFiles;
    private List<String> allowedTypes;
    private Long maxSizeBytes;
    private Integer expirationDays;
    private boolean active;
}
