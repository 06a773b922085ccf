package com.loandesk.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record ManualSnapshotRequest(
        @NotNull(message = "Year is required")
        @Min(value = 2000, message = "Year is out of range")
        @Max(value = 2100, message = "Year is out of range")
        Integer year,

        @NotNull(message = "Month is required")
        @Min(value = 1, message = "Month must be between 1 and 12")
        @Max(value = 12, message = "Month must be between 1 and 12")
        Integer month
) {
}
