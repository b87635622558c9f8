package com.filelink.api.settings;

import java.util.Map;
import java.util.Optional;

/**
 * Flat name to value persistence for runtime settings.
 */
public interface SettingsStore {

    Optional<String> getSetting(String name);

    void putSetting(String name, String value);

    Map<String, String> getAll();
}
