package com.loandesk.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record CreateStageRequest(
        @NotBlank(message = "Stage code is required")
        String code,

        @NotBlank(message = "Stage name is required")
        String name,

        @NotNull(message = "Stage order is required")
        @PositiveOrZero(message = "Stage order must not be negative")
        Integer stageOrder,

        String color,

        Boolean required,

        Boolean triggersCommission
) {
}
