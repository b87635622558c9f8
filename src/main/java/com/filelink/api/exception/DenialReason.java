package com.filelink.api.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable outcome categories. The bot and the panel map {@link #getMessageKey()} to a
 * localized text and never need to look at exception internals.
 */
public enum DenialReason {
    NOT_FOUND("denial.not-found", HttpStatus.NOT_FOUND),
    OWNER_MISMATCH("denial.owner-mismatch", HttpStatus.FORBIDDEN),
    QUOTA_EXCEEDED("denial.quota-exceeded", HttpStatus.PAYLOAD_TOO_LARGE),
    SUBSCRIPTION_EXPIRED("denial.subscription-expired", HttpStatus.PAYMENT_REQUIRED),
    USER_BLOCKED("denial.user-blocked", HttpStatus.FORBIDDEN),
    CHANNEL_MEMBERSHIP_REQUIRED("denial.channel-membership-required", HttpStatus.FORBIDDEN),
    RATE_LIMITED("denial.rate-limited", HttpStatus.TOO_MANY_REQUESTS),
    SIZE_TOO_LARGE("denial.size-too-large", HttpStatus.PAYLOAD_TOO_LARGE),
    EXTENSION_BLOCKED("denial.extension-blocked", HttpStatus.UNSUPPORTED_MEDIA_TYPE),
    INVALID_TOKEN("denial.link-unavailable", HttpStatus.NOT_FOUND),
    STORAGE_IO_FAILURE("denial.storage-failure", HttpStatus.INTERNAL_SERVER_ERROR),
    TRANSFER_ABORTED("denial.transfer-aborted", HttpStatus.REQUEST_TIMEOUT),
    INVALID_URL("denial.invalid-url", HttpStatus.BAD_REQUEST),
    INVALID_SETTING("denial.invalid-setting", HttpStatus.BAD_REQUEST),
    BOT_PAUSED("denial.bot-paused", HttpStatus.SERVICE_UNAVAILABLE),
    TASK_FINISHED("denial.task-finished", HttpStatus.CONFLICT),
    QUEUE_FULL("denial.queue-full", HttpStatus.SERVICE_UNAVAILABLE);

    private final String messageKey;
    private final HttpStatus httpStatus;

    DenialReason(String messageKey, HttpStatus httpStatus) {
        this.messageKey = messageKey;
        this.httpStatus = httpStatus;
    }

    public String getMessageKey() {
        return messageKey;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
