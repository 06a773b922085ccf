package com.loandesk.api.response;

/**
 * @param allowed whether the actor may perform the transition
 * @param reason  why it is refused, {@code null} when allowed
 */
public record TransitionCheckResponse(
        boolean allowed,
        String reason
) {
    public static TransitionCheckResponse allow() {
        return new TransitionCheckResponse(true, null);
    }

    public static TransitionCheckResponse deny(String reason) {
        return new TransitionCheckResponse(false, reason);
    }
}
