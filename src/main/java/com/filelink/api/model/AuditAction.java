package com.filelink.api.model;

public enum AuditAction {
    FILE_REGISTERED,
    FILE_EXPIRED,
    FILE_DELETED,
    FILE_PURGED,
    LINK_REGENERATED,
    USER_BLOCKED,
    USER_UNBLOCKED,
    SUBSCRIPTION_GRANTED,
    SETTING_UPDATED,
    BOT_PAUSED,
    BOT_RESUMED,
    BROADCAST_SENT
}
