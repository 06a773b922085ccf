package com.loandesk.api;

/**
 * HTTP headers shared by the loandesk API and its clients.
 */
public final class ApiHeaders {

    /**
     * Identifier of the acting user, set by the gateway after authentication.
     */
    public static final String USER_ID = "X-User-Id";

    private ApiHeaders() {
    }
}
