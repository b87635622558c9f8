package com.filelink.api.service;

import com.filelink.api.model.AuditAction;
import com.filelink.api.model.FileRecord;
import com.filelink.api.repository.FileRepository;
import com.filelink.api.settings.SettingsService;
import com.filelink.api.support.IntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class FileCleanupServiceTest extends IntegrationTest {

    @Autowired
    private FileCleanupService cleanupService;

    @Autowired
    private FileRepository fileRepository;

    @Autowired
    private FileRegistry fileRegistry;

    @Autowired
    private SettingsService settings;

    private Path storageRoot;

    @BeforeEach
    void locateStorage() {
        storageRoot = Paths.get(settings.uploadDir()).toAbsolutePath().normalize();
    }

    private FileRecord reload(String fileId) {
        return fileRepository.findById(fileId).orElseThrow();
    }

    @Test
    void expiresEachFileExactlyOnce() {
        long owner = newUserId();
        Registration registration = upload(owner, "short.txt", randomBytes(64), 1);
        String fileId = registration.getFile().getId();
        Path bytes = storageRoot.resolve(registration.getFile().getStorageName());
        assertThat(bytes).exists();

        clock.advance(Duration.ofHours(23));
        cleanupService.sweep();
        assertThat(reload(fileId).isDeleted()).isFalse();

        clock.advance(Duration.ofHours(1));
        cleanupService.sweep();
        clock.advance(Duration.ofMinutes(1));
        cleanupService.sweep();

        FileRecord file = reload(fileId);
        assertThat(file.isDeleted()).isTrue();
        assertThat(file.isPurged()).isTrue();
        assertThat(bytes).doesNotExist();
        assertThat(auditCount(fileId, AuditAction.FILE_EXPIRED)).isEqualTo(1);
        assertThat(auditCount(fileId, AuditAction.FILE_PURGED)).isEqualTo(1);
    }

    @Test
    void storageFailureIsRetriedOnTheNextPass() throws IOException {
        long owner = newUserId();
        Registration registration = upload(owner, "stuck.txt", randomBytes(64), 1);
        String fileId = registration.getFile().getId();
        Path bytes = storageRoot.resolve(registration.getFile().getStorageName());

        // A non-empty directory under the same name cannot be deleted
        Files.delete(bytes);
        Files.createDirectory(bytes);
        Path blocker = Files.createFile(bytes.resolve("blocker"));

        clock.advance(Duration.ofDays(2));
        cleanupService.sweep();

        FileRecord file = reload(fileId);
        assertThat(file.isDeleted()).isTrue();
        assertThat(file.isPurged()).isFalse();
        assertThat(auditCount(fileId, AuditAction.FILE_EXPIRED)).isEqualTo(1);
        assertThat(auditCount(fileId, AuditAction.FILE_PURGED)).isZero();

        Files.delete(blocker);
        Files.delete(bytes);
        clock.advance(Duration.ofMinutes(1));
        cleanupService.sweep();

        assertThat(reload(fileId).isPurged()).isTrue();
        assertThat(auditCount(fileId, AuditAction.FILE_EXPIRED)).isEqualTo(1);
        assertThat(auditCount(fileId, AuditAction.FILE_PURGED)).isEqualTo(1);
    }

    @Test
    void sharedBytesStayUntilTheLastRecordIsPurged() {
        byte[] content = randomBytes(256);
        Registration first = upload(newUserId(), "one.bin", content, 1);
        long secondOwner = newUserId();
        Registration second = upload(secondOwner, "two.bin", content, 7);
        assertThat(second.getFile().getStorageName()).isEqualTo(first.getFile().getStorageName());
        Path bytes = storageRoot.resolve(first.getFile().getStorageName());

        clock.advance(Duration.ofDays(2));
        cleanupService.sweep();

        assertThat(reload(first.getFile().getId()).isPurged()).isTrue();
        assertThat(reload(second.getFile().getId()).isDeleted()).isFalse();
        assertThat(bytes).exists();

        fileRegistry.softDelete(second.getFile().getId(), Requester.user(secondOwner));
        clock.advance(Duration.ofMinutes(1));
        cleanupService.sweep();

        assertThat(reload(second.getFile().getId()).isPurged()).isTrue();
        assertThat(bytes).doesNotExist();
    }

    @Test
    void userDeletedFilesArePurgedByALaterPass() {
        long owner = newUserId();
        Registration registration = upload(owner, "mine.txt", randomBytes(64), 7);
        String fileId = registration.getFile().getId();
        Path bytes = storageRoot.resolve(registration.getFile().getStorageName());

        fileRegistry.softDelete(fileId, Requester.user(owner));
        clock.advance(Duration.ofSeconds(1));
        cleanupService.sweep();

        assertThat(reload(fileId).isPurged()).isTrue();
        assertThat(bytes).doesNotExist();
        assertThat(auditCount(fileId, AuditAction.FILE_EXPIRED)).isZero();
        assertThat(auditCount(fileId, AuditAction.FILE_DELETED)).isEqualTo(1);
    }

    @Test
    void orphanScanRemovesOnlyOldUnreferencedFiles() throws IOException {
        Registration registration = upload(newUserId(), "kept.txt", randomBytes(64), 7);
        Path referenced = storageRoot.resolve(registration.getFile().getStorageName());
        Path oldOrphan = Files.write(storageRoot.resolve(UUID.randomUUID().toString()), randomBytes(16));
        Path freshOrphan = Files.write(storageRoot.resolve(UUID.randomUUID().toString()), randomBytes(16));
        Path hidden = Files.write(storageRoot.resolve("." + UUID.randomUUID()), randomBytes(16));

        FileTime old = FileTime.from(clock.instant().minus(Duration.ofHours(2)));
        Files.setLastModifiedTime(referenced, old);
        Files.setLastModifiedTime(oldOrphan, old);
        Files.setLastModifiedTime(hidden, old);
        Files.setLastModifiedTime(freshOrphan, FileTime.from(clock.instant().minus(Duration.ofMinutes(10))));

        int removed = cleanupService.cleanOrphanFiles();

        assertThat(removed).isGreaterThanOrEqualTo(1);
        assertThat(oldOrphan).doesNotExist();
        assertThat(freshOrphan).exists();
        assertThat(hidden).exists();
        assertThat(referenced).exists();

        Files.delete(freshOrphan);
        Files.delete(hidden);
    }
}
