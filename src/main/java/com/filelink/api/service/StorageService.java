package com.filelink.api.service;

import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

public interface StorageService {

    // 1. Copy the bytes to the volume under a fresh random name. Nothing is left behind on failure.
    StoredObject store(InputStream content, long maxBytes, Instant deadline);

    // 2. Load the actual file bytes for downloading
    Resource loadAsResource(String storageName) throws IOException;

    boolean exists(String storageName);

    // 3. Remove the bytes. Missing files are not an error.
    void delete(String storageName) throws IOException;

    // Everything currently on the volume, for the orphan scan
    List<Path> listStoredFiles() throws IOException;
}
