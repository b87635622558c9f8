package com.filelink.api.settings;

import com.filelink.api.config.FileLinkProperties;
import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Typed view over the settings store with {@link FileLinkProperties} as fallback.
 *
 * Getters read the store on every call, so an administrator's change is visible to the
 * next request. {@link SettingKey#isRestartRequired()} values are captured once here.
 */
@Slf4j
@Service
public class SettingsService {

    private static final String MASK = "********";
    private static final int MAX_DAYS = 3650;

    private final SettingsStore store;
    private final FileLinkProperties properties;
    private final String botToken;
    private final String uploadDir;

    public SettingsService(SettingsStore store, FileLinkProperties properties) {
        this.store = store;
        this.properties = properties;
        this.botToken = store.getSetting(SettingKey.BOT_TOKEN.name())
                .orElse(properties.getTelegram().getBotToken());
        this.uploadDir = store.getSetting(SettingKey.UPLOAD_DIR.name())
                .orElse(properties.getStorage().getLocation());
    }

    public String botToken() {
        return botToken;
    }

    public String uploadDir() {
        return uploadDir;
    }

    public String downloadDomain() {
        return text(SettingKey.DOWNLOAD_DOMAIN).orElse(properties.getDownloadDomain());
    }

    // A stored empty value switches the check off even when the properties name a channel
    public Optional<String> requiredChannel() {
        Optional<String> stored = store.getSetting(SettingKey.REQUIRED_CHANNEL.name());
        if (stored.isPresent()) {
            return stored.map(String::trim).filter(v -> !v.isEmpty());
        }
        String fallback = properties.getTelegram().getRequiredChannel();
        return fallback == null || fallback.isBlank() ? Optional.empty() : Optional.of(fallback.trim());
    }

    public int trialDays() {
        return number(SettingKey.TRIAL_DAYS).orElse(properties.getTrialDays());
    }

    public int defaultExpiryDays() {
        return number(SettingKey.DEFAULT_EXPIRY_DAYS).orElse(properties.getDefaultExpiryDays());
    }

    public int reminderDays() {
        return number(SettingKey.SUBSCRIPTION_REMINDER_DAYS).orElse(properties.getReminder().getReminderDays());
    }

    public Set<Long> adminIds() {
        return store.getSetting(SettingKey.ADMIN_IDS.name())
                .map(SettingsService::parseIds)
                .orElse(properties.getAdmin().getIds());
    }

    public boolean isAdmin(long userId) {
        return adminIds().contains(userId);
    }

    public Set<String> blockedExtensions() {
        return store.getSetting(SettingKey.BLOCKED_EXTENSIONS.name())
                .map(SettingsService::parseExtensions)
                .orElseGet(() -> normalizeExtensions(properties.getBlockedExtensions()));
    }

    public Set<String> allowedExtensions() {
        return store.getSetting(SettingKey.ALLOWED_EXTENSIONS.name())
                .map(SettingsService::parseExtensions)
                .orElseGet(() -> normalizeExtensions(properties.getAllowedExtensions()));
    }

    /**
     * Validates and persists a setting.
     *
     * @return the key that was written
     */
    public SettingKey update(String name, String value) {
        SettingKey key = SettingKey.fromName(name)
                .orElseThrow(() -> new FileLinkException(DenialReason.INVALID_SETTING, "Unknown setting: " + name));
        String normalized = validate(key, value);
        store.putSetting(key.name(), normalized);

        if (key.isSecret()) {
            log.info("Setting {} updated (value hidden), takes effect after restart", key);
        } else if (key.isRestartRequired()) {
            log.info("Setting {} updated to '{}', takes effect after restart", key, normalized);
        } else {
            log.info("Setting {} updated to '{}'", key, normalized);
        }
        return key;
    }

    /**
     * Current stored values with secrets masked.
     */
    public Map<String, String> listMasked() {
        Map<String, String> result = new LinkedHashMap<>();
        for (SettingKey key : SettingKey.values()) {
            store.getSetting(key.name())
                    .ifPresent(v -> result.put(key.name(), key.isSecret() ? MASK : v));
        }
        return result;
    }

    private String validate(SettingKey key, String value) {
        if (value == null) {
            throw new FileLinkException(DenialReason.INVALID_SETTING, "Value for " + key + " is required");
        }
        String trimmed = value.trim();
        switch (key.getType()) {
            case NUMBER -> {
                int parsed;
                try {
                    parsed = Integer.parseInt(trimmed);
                } catch (NumberFormatException e) {
                    throw new FileLinkException(DenialReason.INVALID_SETTING, key + " must be a whole number", e);
                }
                int min = minimumOf(key);
                int max = maximumOf(key);
                if (parsed < min || parsed > max) {
                    throw new FileLinkException(DenialReason.INVALID_SETTING,
                            key + " must be between " + min + " and " + max);
                }
                return Integer.toString(parsed);
            }
            case ID_LIST -> {
                try {
                    return parseIds(trimmed).stream().map(String::valueOf).collect(Collectors.joining(","));
                } catch (NumberFormatException e) {
                    throw new FileLinkException(DenialReason.INVALID_SETTING, key + " must be a comma separated id list", e);
                }
            }
            case TEXT_LIST -> {
                return String.join(",", parseExtensions(trimmed));
            }
            default -> {
                if (trimmed.isEmpty() && key != SettingKey.REQUIRED_CHANNEL) {
                    throw new FileLinkException(DenialReason.INVALID_SETTING, key + " must not be empty");
                }
                return trimmed;
            }
        }
    }

    // A zero-day trial means new users start without one
    private static int minimumOf(SettingKey key) {
        return key == SettingKey.TRIAL_DAYS ? 0 : 1;
    }

    private int maximumOf(SettingKey key) {
        return switch (key) {
            case DEFAULT_EXPIRY_DAYS -> properties.getMaxExpiryDays();
            case SUBSCRIPTION_REMINDER_DAYS -> 365;
            default -> MAX_DAYS;
        };
    }

    private Optional<String> text(SettingKey key) {
        return store.getSetting(key.name()).map(String::trim).filter(v -> !v.isEmpty());
    }

    private Optional<Integer> number(SettingKey key) {
        return text(key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric value '{}' for setting {}", v, key);
                return Optional.empty();
            }
        });
    }

    static Set<Long> parseIds(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Long::parseLong)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    static Set<String> parseExtensions(String raw) {
        return normalizeExtensions(Arrays.asList(raw.split(",")));
    }

    private static Set<String> normalizeExtensions(Iterable<String> raw) {
        Set<String> result = new LinkedHashSet<>();
        for (String ext : raw) {
            String e = ext.trim().toLowerCase(Locale.ROOT);
            if (e.isEmpty()) {
                continue;
            }
            result.add(e.startsWith(".") ? e : "." + e);
        }
        return result;
    }
}
