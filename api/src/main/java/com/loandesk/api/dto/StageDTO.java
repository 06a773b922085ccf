package com.loandesk.api.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class StageDTO {
    private UUID id;
    private UUID workflowId;
    private String code;
    private String name;
    private Integer stageOrder;
    private String color;
    private boolean required;
    private boolean triggersCommission;
}
