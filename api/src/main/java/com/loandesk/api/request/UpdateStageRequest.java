package com.loandesk.api.request;

import jakarta.validation.constraints.PositiveOrZero;

public record UpdateStageRequest(
        String name,

        @PositiveOrZero(message = "Stage order must not be negative")
        Integer stageOrder,

        String color,

        Boolean triggersCommission
) {
}
