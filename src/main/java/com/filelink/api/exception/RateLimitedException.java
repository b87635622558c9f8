package com.filelink.api.exception;

import com.filelink.api.model.ActionClass;
import lombok.Getter;

import java.time.Duration;

@Getter
public class RateLimitedException extends FileLinkException {

    private final ActionClass actionClass;
    private final Duration retryAfter;

    public RateLimitedException(long userId, ActionClass actionClass, Duration retryAfter) {
        super(DenialReason.RATE_LIMITED,
                "User " + userId + " exceeded the " + actionClass + " limit, retry after " + retryAfter.toMillis() + "ms");
        this.actionClass = actionClass;
        this.retryAfter = retryAfter;
    }
}
