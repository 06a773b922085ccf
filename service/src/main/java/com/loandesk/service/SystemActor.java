package com.loandesk.service;

import java.util.UUID;

/**
 * Actor recorded for changes made by scheduled jobs rather than by a user.
 */
public final class SystemActor {

    public static final UUID ID = UUID.fromString("00000000-0000-0000-0000-000000000000");

    private SystemActor() {
    }
}
