package com.filelink.api.settings;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Names accepted by the settings store. Secret and restart-bound values are read once at
 * startup; every other value is re-read on each use.
 */
public enum SettingKey {
    BOT_TOKEN(ValueType.TEXT, true, true),
    DOWNLOAD_DOMAIN(ValueType.TEXT, false, false),
    UPLOAD_DIR(ValueType.TEXT, false, true),
    SUBSCRIPTION_REMINDER_DAYS(ValueType.NUMBER, false, false),
    ADMIN_IDS(ValueType.ID_LIST, false, false),
    REQUIRED_CHANNEL(ValueType.TEXT, false, false),
    TRIAL_DAYS(ValueType.NUMBER, false, false),
    DEFAULT_EXPIRY_DAYS(ValueType.NUMBER, false, false),
    BLOCKED_EXTENSIONS(ValueType.TEXT_LIST, false, false),
    ALLOWED_EXTENSIONS(ValueType.TEXT_LIST, false, false);

    public enum ValueType {
        TEXT,
        NUMBER,
        ID_LIST,
        TEXT_LIST
    }

    private final ValueType type;
    private final boolean secret;
    private final boolean restartRequired;

    SettingKey(ValueType type, boolean secret, boolean restartRequired) {
        this.type = type;
        this.secret = secret;
        this.restartRequired = restartRequired;
    }

    public ValueType getType() {
        return type;
    }

    public boolean isSecret() {
        return secret;
    }

    public boolean isRestartRequired() {
        return restartRequired;
    }

    public static Optional<SettingKey> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(k -> k.name().equals(normalized)).findFirst();
    }
}
