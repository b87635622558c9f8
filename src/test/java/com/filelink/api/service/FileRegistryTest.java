package com.filelink.api.service;

import com.filelink.api.config.FileLinkProperties.TierQuota;
import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import com.filelink.api.model.AuditAction;
import com.filelink.api.model.FileRecord;
import com.filelink.api.settings.SettingsService;
import com.filelink.api.support.IntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileRegistryTest extends IntegrationTest {

    // No limits except the global size cap
    private static final TierQuota UNLIMITED = new TierQuota(0, 0, 0, 0);

    @Autowired
    private FileRegistry fileRegistry;

    @Autowired
    private UserRegistry userRegistry;

    @Autowired
    private SettingsService settings;

    private FileRecord create(long ownerId, String name, long size, TierQuota quota) {
        return fileRegistry.create(NewFile.builder()
                .ownerId(ownerId)
                .originalFilename(name)
                .contentType("text/plain")
                .size(size)
                .storageName("registry-test-" + UUID.randomUUID())
                .expiryPolicy(ExpiryPolicy.ofDays(7))
                .build(), quota);
    }

    private long newUser() {
        long id = newUserId();
        userRegistry.getOrCreate(id, "u" + id, null);
        return id;
    }

    @Test
    void createsRecordWithExpiryAfterCreation() {
        long owner = newUser();

        FileRecord file = create(owner, "notes.txt", 12, UNLIMITED);

        assertThat(file.getId()).isNotBlank();
        assertThat(file.getExpiryTime()).isEqualTo(file.getCreatedAt().plusDays(7));
        assertThat(file.isDeleted()).isFalse();
        assertThat(fileRegistry.get(file.getId()).getOriginalFilename()).isEqualTo("notes.txt");
        assertThat(auditCount(file.getId(), AuditAction.FILE_REGISTERED)).isEqualTo(1);
    }

    @Test
    void rejectsNonPositiveExpiry() {
        assertThatThrownBy(() -> ExpiryPolicy.of(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExpiryPolicy.ofDays(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stripsPathsFromNames() {
        long owner = newUser();

        FileRecord file = create(owner, "../../etc/passwd", 1, UNLIMITED);

        assertThat(file.getOriginalFilename()).isEqualTo("passwd");
    }

    @Test
    void blockedExtensionWinsOverAllowlist() {
        long owner = newUser();
        settings.update("ALLOWED_EXTENSIONS", ".pdf,.exe");
        try {
            assertThatThrownBy(() -> create(owner, "setup.EXE", 1, UNLIMITED))
                    .isInstanceOf(FileLinkException.class)
                    .extracting("reason").isEqualTo(DenialReason.EXTENSION_BLOCKED);
            assertThatThrownBy(() -> create(owner, "photo.png", 1, UNLIMITED))
                    .isInstanceOf(FileLinkException.class)
                    .extracting("reason").isEqualTo(DenialReason.EXTENSION_BLOCKED);
            assertThat(create(owner, "paper.pdf", 1, UNLIMITED).getId()).isNotBlank();
        } finally {
            settings.update("ALLOWED_EXTENSIONS", "");
        }
    }

    @Test
    void enforcesSizeAndQuotaLimits() {
        long owner = newUser();
        TierQuota quota = new TierQuota(100, 2, 150, 0);

        assertThatThrownBy(() -> create(owner, "big.bin", 101, quota))
                .isInstanceOf(FileLinkException.class)
                .extracting("reason").isEqualTo(DenialReason.SIZE_TOO_LARGE);

        create(owner, "a.bin", 100, quota);
        assertThatThrownBy(() -> create(owner, "b.bin", 60, quota))
                .isInstanceOf(FileLinkException.class)
                .extracting("reason").isEqualTo(DenialReason.QUOTA_EXCEEDED);

        create(owner, "c.bin", 50, quota);
        assertThatThrownBy(() -> create(owner, "d.bin", 0, quota))
                .isInstanceOf(FileLinkException.class)
                .extracting("reason").isEqualTo(DenialReason.QUOTA_EXCEEDED);
        assertThat(fileRegistry.remainingAllowance(owner, quota)).isZero();
    }

    @Test
    void refusesFilesForBlockedOwner() {
        long owner = newUser();
        userRegistry.block(owner, "spam", null);

        assertThatThrownBy(() -> create(owner, "a.txt", 1, UNLIMITED))
                .isInstanceOf(FileLinkException.class)
                .extracting("reason").isEqualTo(DenialReason.USER_BLOCKED);
    }

    @Test
    void listsLiveFilesNewestFirstAcrossPages() {
        long owner = newUser();
        int count = FileRegistry.PAGE_SIZE + 5;
        for (int i = 0; i < count; i++) {
            create(owner, "file-" + i + ".txt", 1, UNLIMITED);
            clock.advance(Duration.ofSeconds(1));
        }
        FileRecord deleted = create(owner, "gone.txt", 1, UNLIMITED);
        fileRegistry.softDelete(deleted.getId(), Requester.user(owner));

        List<String> names = fileRegistry.listByOwner(owner, null)
                .map(FileRecord::getOriginalFilename)
                .collect(Collectors.toList());

        assertThat(names).hasSize(count);
        assertThat(names.get(0)).isEqualTo("file-" + (count - 1) + ".txt");
        assertThat(names.get(count - 1)).isEqualTo("file-0.txt");
        assertThat(names).doesNotContain("gone.txt");
    }

    @Test
    void searchMatchesPartOfTheName() {
        long owner = newUser();
        create(owner, "Quarterly-Report.pdf", 1, UNLIMITED);
        create(owner, "holiday.jpg", 1, UNLIMITED);

        assertThat(fileRegistry.listByOwner(owner, "report").map(FileRecord::getOriginalFilename))
                .containsExactly("Quarterly-Report.pdf");
        assertThat(fileRegistry.listByOwner(newUser(), "report")).isEmpty();
    }

    @Test
    void softDeleteIsIdempotentAndAuditedOnce() {
        long owner = newUser();
        FileRecord file = create(owner, "a.txt", 1, UNLIMITED);

        assertThat(fileRegistry.softDelete(file.getId(), Requester.user(owner)))
                .isEqualTo(FileRegistry.DeleteOutcome.DELETED);
        assertThat(fileRegistry.softDelete(file.getId(), Requester.user(owner)))
                .isEqualTo(FileRegistry.DeleteOutcome.ALREADY_DELETED);

        assertThat(fileRegistry.get(file.getId()).isDeleted()).isTrue();
        assertThat(auditCount(file.getId(), AuditAction.FILE_DELETED)).isEqualTo(1);
    }

    @Test
    void concurrentDeletesBothSucceed() throws Exception {
        long owner = newUser();
        FileRecord file = create(owner, "a.txt", 1, UNLIMITED);

        CompletableFuture<FileRegistry.DeleteOutcome> first =
                CompletableFuture.supplyAsync(() -> fileRegistry.softDelete(file.getId(), Requester.user(owner)));
        CompletableFuture<FileRegistry.DeleteOutcome> second =
                CompletableFuture.supplyAsync(() -> fileRegistry.softDelete(file.getId(), Requester.panel()));

        assertThat(first.get(20, TimeUnit.SECONDS)).isNotNull();
        assertThat(second.get(20, TimeUnit.SECONDS)).isNotNull();
        assertThat(fileRegistry.get(file.getId()).isDeleted()).isTrue();
    }

    @Test
    void onlyOwnerOrAdministratorMayDelete() {
        long owner = newUser();
        long stranger = newUser();
        FileRecord mine = create(owner, "a.txt", 1, UNLIMITED);
        FileRecord other = create(owner, "b.txt", 1, UNLIMITED);

        assertThatThrownBy(() -> fileRegistry.softDelete(mine.getId(), Requester.user(stranger)))
                .isInstanceOf(FileLinkException.class)
                .extracting("reason").isEqualTo(DenialReason.OWNER_MISMATCH);
        assertThat(fileRegistry.get(mine.getId()).isDeleted()).isFalse();

        assertThat(fileRegistry.softDelete(mine.getId(), Requester.user(owner)))
                .isEqualTo(FileRegistry.DeleteOutcome.DELETED);
        assertThat(fileRegistry.softDelete(other.getId(), Requester.admin(stranger)))
                .isEqualTo(FileRegistry.DeleteOutcome.DELETED);
    }

    @Test
    void unknownFileIsNotFound() {
        assertThatThrownBy(() -> fileRegistry.softDelete("missing", Requester.panel()))
                .isInstanceOf(FileLinkException.class)
                .extracting("reason").isEqualTo(DenialReason.NOT_FOUND);
    }

    @Test
    void blockedOwnerCannotDeleteTheirFiles() {
        long owner = newUser();
        FileRecord file = create(owner, "a.txt", 1, UNLIMITED);
        userRegistry.block(owner, "spam", null);

        assertThatThrownBy(() -> fileRegistry.softDelete(file.getId(), Requester.user(owner)))
                .isInstanceOf(FileLinkException.class)
                .extracting("reason").isEqualTo(DenialReason.USER_BLOCKED);
        assertThatThrownBy(() -> fileRegistry.softDeleteAll(List.of(file.getId()), Requester.user(owner)))
                .isInstanceOf(FileLinkException.class)
                .extracting("reason").isEqualTo(DenialReason.USER_BLOCKED);
        assertThat(fileRegistry.get(file.getId()).isDeleted()).isFalse();
        assertThat(auditCount(file.getId(), AuditAction.FILE_DELETED)).isZero();

        assertThat(fileRegistry.softDelete(file.getId(), Requester.panel()))
                .isEqualTo(FileRegistry.DeleteOutcome.DELETED);
    }

    @Test
    void temporaryBlockLiftsByItself() {
        long owner = newUser();
        userRegistry.block(owner, "cooldown", LocalDateTime.now(clock).plusHours(2));

        assertThatThrownBy(() -> create(owner, "a.txt", 1, UNLIMITED))
                .isInstanceOf(FileLinkException.class)
                .extracting("reason").isEqualTo(DenialReason.USER_BLOCKED);

        clock.advance(Duration.ofHours(2));

        FileRecord file = create(owner, "a.txt", 1, UNLIMITED);
        assertThat(fileRegistry.softDelete(file.getId(), Requester.user(owner)))
                .isEqualTo(FileRegistry.DeleteOutcome.DELETED);
    }

    @Test
    void bulkDeleteSkipsFilesOfOtherOwners() {
        long owner = newUser();
        long other = newUser();
        FileRecord first = create(owner, "a.txt", 1, UNLIMITED);
        FileRecord second = create(owner, "b.txt", 1, UNLIMITED);
        FileRecord foreign = create(other, "c.txt", 1, UNLIMITED);

        int deleted = fileRegistry.softDeleteAll(
                List.of(first.getId(), second.getId(), foreign.getId(), "missing", first.getId()),
                Requester.user(owner));

        assertThat(deleted).isEqualTo(2);
        assertThat(fileRegistry.get(first.getId()).isDeleted()).isTrue();
        assertThat(fileRegistry.get(second.getId()).isDeleted()).isTrue();
        assertThat(fileRegistry.get(foreign.getId()).isDeleted()).isFalse();
        assertThat(auditCount(first.getId(), AuditAction.FILE_DELETED)).isEqualTo(1);

        assertThat(fileRegistry.softDeleteAll(List.of(first.getId()), Requester.user(owner))).isZero();
        assertThatThrownBy(() -> fileRegistry.softDeleteAll(List.of(), Requester.user(owner)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
