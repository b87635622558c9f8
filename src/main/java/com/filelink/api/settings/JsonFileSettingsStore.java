package com.filelink.api.settings;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Keeps settings in a single JSON object on disk. Writes go to a temp file first and
 * replace the original with an atomic move.
 */
@Slf4j
@Component
public class JsonFileSettingsStore implements SettingsStore {

    private static final TypeReference<TreeMap<String, String>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path file;
    private Map<String, String> values;

    public JsonFileSettingsStore(ObjectMapper objectMapper,
                                 @Value("${filelink.settings-file:config/settings.json}") String settingsFile) {
        this.objectMapper = objectMapper;
        this.file = Paths.get(settingsFile);
        this.values = load();
    }

    private Map<String, String> load() {
        if (!Files.exists(file)) {
            log.info("No settings file at {}, starting with defaults", file.toAbsolutePath());
            return new TreeMap<>();
        }
        try {
            return objectMapper.readValue(file.toFile(), MAP_TYPE);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read settings file " + file.toAbsolutePath(), e);
        }
    }

    @Override
    public synchronized Optional<String> getSetting(String name) {
        return Optional.ofNullable(values.get(name));
    }

    @Override
    public synchronized void putSetting(String name, String value) {
        TreeMap<String, String> updated = new TreeMap<>(values);
        updated.put(name, value);
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = dir.resolve(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), updated);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new FileLinkException(DenialReason.STORAGE_IO_FAILURE, "Could not persist setting " + name, e);
        }
        values = updated;
    }

    @Override
    public synchronized Map<String, String> getAll() {
        return Collections.unmodifiableMap(new TreeMap<>(values));
    }
}
