package com.loandesk.api.request;

public record UpdateWorkflowRequest(
        String name,
        String description,
        Boolean active
) {
}
