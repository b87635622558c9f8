package com.filelink.api.settings;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class SettingKeyTest {

    @Test
    void namesResolveRegardlessOfCase() {
        assertThat(SettingKey.fromName(" trial_days ")).contains(SettingKey.TRIAL_DAYS);
        assertThat(SettingKey.fromName("Upload_Dir")).contains(SettingKey.UPLOAD_DIR);
        assertThat(SettingKey.fromName("no_such_key")).isEmpty();
        assertThat(SettingKey.fromName(null)).isEmpty();
    }

    @Test
    void namesResolveUnderTheTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            // "i".toUpperCase() is a dotted capital I there
            assertThat(SettingKey.fromName("admin_ids")).contains(SettingKey.ADMIN_IDS);
            assertThat(SettingKey.fromName("required_channel")).contains(SettingKey.REQUIRED_CHANNEL);
        } finally {
            Locale.setDefault(previous);
        }
    }
}
