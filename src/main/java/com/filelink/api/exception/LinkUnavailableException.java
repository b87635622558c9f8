package com.filelink.api.exception;

import lombok.Getter;

/**
 * Every failed link resolution. Externally always {@link DenialReason#INVALID_TOKEN};
 * the {@link Cause} is kept for administrator diagnostics only.
 */
@Getter
public class LinkUnavailableException extends FileLinkException {

    public enum Cause {
        NEVER_EXISTED,
        EXPIRED,
        DELETED,
        OWNER_BLOCKED,
        OWNER_RATE_LIMITED,
        OWNER_QUOTA_EXCEEDED
    }

    private final Cause diagnosticCause;
    private final String fileId;

    public LinkUnavailableException(Cause diagnosticCause, String fileId) {
        super(DenialReason.INVALID_TOKEN, "Link unavailable");
        this.diagnosticCause = diagnosticCause;
        this.fileId = fileId;
    }
}
