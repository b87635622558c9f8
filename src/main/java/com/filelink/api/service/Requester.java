package com.filelink.api.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Who is asking for a file operation. Administrator status is decided by the caller.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Requester {

    // Actor id used for calls from the admin panel
    public static final long PANEL_ACTOR_ID = 0L;

    long userId;

    boolean admin;

    public static Requester user(long userId) {
        return new Requester(userId, false);
    }

    public static Requester admin(long userId) {
        return new Requester(userId, true);
    }

    public static Requester panel() {
        return new Requester(PANEL_ACTOR_ID, true);
    }
}
