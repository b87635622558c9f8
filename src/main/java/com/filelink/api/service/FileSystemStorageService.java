package com.filelink.api.service;

import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import com.filelink.api.settings.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Service
public class FileSystemStorageService implements StorageService {

    static final String PARTIAL_SUFFIX = ".part";

    private final Path rootLocation; // The upload folder, e.g. ./filelink_uploads
    private final Clock clock;

    public FileSystemStorageService(SettingsService settings, Clock clock) {
        this.rootLocation = Paths.get(settings.uploadDir()).toAbsolutePath().normalize();
        this.clock = clock;
        init(); // Ensure the folder exists
    }

    private void init() {
        try {
            Files.createDirectories(rootLocation);
        } catch (IOException e) {
            throw new IllegalStateException("Could not initialize storage location " + rootLocation, e);
        }
    }

    @Override
    public StoredObject store(InputStream content, long maxBytes, Instant deadline) {
        // 1. Random storage name so "resume.pdf" never overwrites another "resume.pdf"
        String storageName = UUID.randomUUID().toString();
        Path partial = resolve(storageName + PARTIAL_SUFFIX);
        Path destination = resolve(storageName);

        MessageDigest digest = sha256();
        BoundedInputStream bounded = new BoundedInputStream(content, maxBytes, clock, deadline);

        // 2. Stream: source -> size/time guard -> hash -> 64KB buffer -> partial file
        try (InputStream hashing = new DigestInputStream(bounded, digest);
             OutputStream out = new BufferedOutputStream(Files.newOutputStream(partial), 65536)) {
            hashing.transferTo(out);
        } catch (BoundedInputStream.TransferLimitException e) {
            discard(partial);
            throw new FileLinkException(e.getReason(), e.getMessage(), e);
        } catch (InterruptedIOException e) {
            discard(partial);
            throw new FileLinkException(DenialReason.TRANSFER_ABORTED, "Transfer cancelled", e);
        } catch (IOException e) {
            discard(partial);
            throw FileLinkException.storageFailure("Could not write file to storage", e);
        }

        // 3. Only complete files ever carry their final name
        try {
            Files.move(partial, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            discard(partial);
            throw FileLinkException.storageFailure("Could not finalize stored file", e);
        }

        String hash = HexFormat.of().formatHex(digest.digest());
        log.debug("Stored {} bytes as {}", bounded.getCount(), storageName);
        return new StoredObject(storageName, bounded.getCount(), hash);
    }

    @Override
    public Resource loadAsResource(String storageName) throws IOException {
        // Find file on disk using the storage name, NOT the original filename
        Path filePath = resolve(storageName);
        if (!Files.isRegularFile(filePath)) {
            throw new NoSuchFileException(filePath.toString(), null, "Stored file is missing");
        }
        return new FileSystemResource(filePath);
    }

    @Override
    public boolean exists(String storageName) {
        return Files.isRegularFile(resolve(storageName));
    }

    @Override
    public void delete(String storageName) throws IOException {
        Files.deleteIfExists(resolve(storageName));
    }

    @Override
    public List<Path> listStoredFiles() throws IOException {
        try (Stream<Path> files = Files.list(rootLocation)) {
            return files.collect(Collectors.toList());
        }
    }

    private Path resolve(String storageName) {
        Path path = rootLocation.resolve(storageName).normalize();
        if (!path.getParent().equals(rootLocation)) {
            throw new FileLinkException(DenialReason.NOT_FOUND, "Invalid storage name");
        }
        return path;
    }

    private void discard(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            // The orphan scan picks it up later
            log.warn("Could not remove partial file {}: {}", partial.getFileName(), e.getMessage());
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
