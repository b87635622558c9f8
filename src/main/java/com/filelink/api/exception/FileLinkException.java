package com.filelink.api.exception;

import lombok.Getter;

/**
 * Terminal failure of a single request. Services throw it, the web layer maps it.
 */
@Getter
public class FileLinkException extends RuntimeException {

    private final DenialReason reason;

    public FileLinkException(DenialReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public FileLinkException(DenialReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static FileLinkException notFound(String what) {
        return new FileLinkException(DenialReason.NOT_FOUND, what + " not found");
    }

    public static FileLinkException ownerMismatch(String fileId, long requesterId) {
        return new FileLinkException(DenialReason.OWNER_MISMATCH,
                "User " + requesterId + " neither owns file " + fileId + " nor is an administrator");
    }

    public static FileLinkException storageFailure(String message, Throwable cause) {
        return new FileLinkException(DenialReason.STORAGE_IO_FAILURE, message, cause);
    }
}
