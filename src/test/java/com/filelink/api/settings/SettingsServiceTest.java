package com.filelink.api.settings;

import com.filelink.api.config.FileLinkProperties;
import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsServiceTest {

    // In-memory store, enough for the service logic
    static class MapSettingsStore implements SettingsStore {

        private final Map<String, String> values = new TreeMap<>();

        @Override
        public Optional<String> getSetting(String name) {
            return Optional.ofNullable(values.get(name));
        }

        @Override
        public void putSetting(String name, String value) {
            values.put(name, value);
        }

        @Override
        public Map<String, String> getAll() {
            return Collections.unmodifiableMap(values);
        }
    }

    private MapSettingsStore store;
    private FileLinkProperties properties;
    private SettingsService settings;

    @BeforeEach
    void setUp() {
        store = new MapSettingsStore();
        properties = new FileLinkProperties();
        properties.getTelegram().setBotToken("startup-token");
        settings = new SettingsService(store, properties);
    }

    @Test
    void fallsBackToPropertiesWhenStoreIsEmpty() {
        assertThat(settings.downloadDomain()).isEqualTo(properties.getDownloadDomain());
        assertThat(settings.trialDays()).isEqualTo(7);
        assertThat(settings.requiredChannel()).isEmpty();
        assertThat(settings.blockedExtensions()).contains(".exe", ".sh");
    }

    @Test
    void appliesNonSecretChangesWithoutRestart() {
        settings.update("download_domain", "dl.example.org");
        settings.update("TRIAL_DAYS", " 14 ");
        settings.update("ADMIN_IDS", "5, 6,7");

        assertThat(settings.downloadDomain()).isEqualTo("dl.example.org");
        assertThat(settings.trialDays()).isEqualTo(14);
        assertThat(settings.adminIds()).containsExactly(5L, 6L, 7L);
        assertThat(settings.isAdmin(6)).isTrue();
    }

    @Test
    void keepsRestartBoundValuesUntilRestart() {
        SettingKey key = settings.update("BOT_TOKEN", "new-token");

        assertThat(key.isRestartRequired()).isTrue();
        assertThat(settings.botToken()).isEqualTo("startup-token");
        assertThat(new SettingsService(store, properties).botToken()).isEqualTo("new-token");
    }

    @Test
    void masksSecretsInListing() {
        settings.update("BOT_TOKEN", "123:abc");
        settings.update("DOWNLOAD_DOMAIN", "dl.example.org");

        Map<String, String> listed = settings.listMasked();

        assertThat(listed.get("BOT_TOKEN")).doesNotContain("123");
        assertThat(listed).containsEntry("DOWNLOAD_DOMAIN", "dl.example.org");
    }

    @Test
    void normalizesExtensionLists() {
        settings.update("BLOCKED_EXTENSIONS", "EXE, .Apk ,,bat");

        assertThat(settings.blockedExtensions()).containsExactly(".exe", ".apk", ".bat");
    }

    @Test
    void rejectsUnknownNamesAndBadValues() {
        assertThatThrownBy(() -> settings.update("NOPE", "1"))
                .isInstanceOf(FileLinkException.class)
                .extracting("reason").isEqualTo(DenialReason.INVALID_SETTING);
        assertThatThrownBy(() -> settings.update("TRIAL_DAYS", "seven"))
                .isInstanceOf(FileLinkException.class)
                .extracting("reason").isEqualTo(DenialReason.INVALID_SETTING);
        assertThatThrownBy(() -> settings.update("ADMIN_IDS", "1,x"))
                .isInstanceOf(FileLinkException.class)
                .extracting("reason").isEqualTo(DenialReason.INVALID_SETTING);
        assertThat(store.getAll()).isEmpty();
    }

    @Test
    void emptyRequiredChannelSwitchesTheCheckOff() {
        properties.getTelegram().setRequiredChannel("@fromconfig");
        assertThat(settings.requiredChannel()).contains("@fromconfig");

        settings.update("REQUIRED_CHANNEL", "@news");
        assertThat(settings.requiredChannel()).contains("@news");

        settings.update("REQUIRED_CHANNEL", "");
        assertThat(settings.requiredChannel()).isEmpty();
    }

    @Test
    void keepsNumbersWithinTheRangeOfEachSetting() {
        for (String value : new String[] {"0", "31", "-1"}) {
            assertThatThrownBy(() -> settings.update("DEFAULT_EXPIRY_DAYS", value))
                    .isInstanceOf(FileLinkException.class)
                    .extracting("reason").isEqualTo(DenialReason.INVALID_SETTING);
        }
        assertThatThrownBy(() -> settings.update("SUBSCRIPTION_REMINDER_DAYS", "0"))
                .isInstanceOf(FileLinkException.class);
        assertThatThrownBy(() -> settings.update("TRIAL_DAYS", "-3"))
                .isInstanceOf(FileLinkException.class);
        assertThat(store.getAll()).isEmpty();

        settings.update("DEFAULT_EXPIRY_DAYS", "30");
        settings.update("TRIAL_DAYS", "0");

        assertThat(settings.defaultExpiryDays()).isEqualTo(30);
        assertThat(settings.trialDays()).isZero();
    }
}
