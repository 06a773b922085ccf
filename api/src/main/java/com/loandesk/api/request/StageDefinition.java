package com.loandesk.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Stage entry of a workflow definition.
 *
 * @param code               stage code, stored upper case
 * @param name               display name
 * @param stageOrder         position in the default linear sequence
 * @param color              display color, {@code #6B7280} when omitted
 * @param triggersCommission whether entering the stage fires commission processing
 */
public record StageDefinition(
        @NotBlank(message = "Stage code is required")
        String code,

        @NotBlank(message = "Stage name is required")
        String name,

        @NotNull(message = "Stage order is required")
        @PositiveOrZero(message = "Stage order must not be negative")
        Integer stageOrder,

        String color,

        Boolean triggersCommission
) {
}
