package com.filelink.api.service;

import com.filelink.api.config.FileLinkProperties;
import com.filelink.api.config.FileLinkProperties.TierQuota;
import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import com.filelink.api.model.AuditAction;
import com.filelink.api.model.FileRecord;
import com.filelink.api.model.UserAccount;
import com.filelink.api.repository.FileRepository;
import com.filelink.api.settings.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Durable file metadata: creation with quota checks, lookup, listing and soft delete.
 */
@Slf4j
@Service
public class FileRegistry {

    static final int PAGE_SIZE = 50;
    private static final int MAX_NAME_LENGTH = 255;
    static final int MAX_BULK_DELETE = 100;
    private static final Duration DEDUP_MIN_REMAINING = Duration.ofHours(1);

    public enum DeleteOutcome {
        DELETED,
        ALREADY_DELETED
    }

    private final FileRepository fileRepository;
    private final UserRegistry userRegistry;
    private final SettingsService settings;
    private final FileLinkProperties properties;
    private final AuditService auditService;
    private final Clock clock;

    public FileRegistry(FileRepository fileRepository,
                        UserRegistry userRegistry,
                        SettingsService settings,
                        FileLinkProperties properties,
                        AuditService auditService,
                        Clock clock) {
        this.fileRepository = fileRepository;
        this.userRegistry = userRegistry;
        this.settings = settings;
        this.properties = properties;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Checks owner, extension, size and quota. Runs before any byte is written and again
     * inside {@link #create}.
     */
    public void validate(long ownerId, String name, long size, TierQuota quota) {
        UserAccount owner = userRegistry.get(ownerId);
        if (owner.isBlockedAt(LocalDateTime.now(clock))) {
            throw UserRegistry.blockedError(owner);
        }
        checkExtension(name);

        long maxFileSize = maxFileSize(quota);
        if (size > maxFileSize) {
            throw new FileLinkException(DenialReason.SIZE_TOO_LARGE,
                    "File of " + size + " bytes exceeds the limit of " + maxFileSize + " bytes");
        }

        long files = fileRepository.countByOwnerIdAndDeletedFalse(ownerId);
        if (quota.getMaxFiles() > 0 && files + 1 > quota.getMaxFiles()) {
            throw new FileLinkException(DenialReason.QUOTA_EXCEEDED,
                    "File count limit of " + quota.getMaxFiles() + " reached");
        }
        long used = fileRepository.sumLiveBytesByOwner(ownerId);
        if (quota.getMaxStorageBytes() > 0 && used + Math.max(size, 0) > quota.getMaxStorageBytes()) {
            throw new FileLinkException(DenialReason.QUOTA_EXCEEDED,
                    "Storage limit of " + quota.getMaxStorageBytes() + " bytes reached");
        }
    }

    /**
     * Largest byte count a new file may have for this quota, counting storage already used.
     */
    public long remainingAllowance(long ownerId, TierQuota quota) {
        long allowance = maxFileSize(quota);
        if (quota.getMaxStorageBytes() > 0) {
            long free = quota.getMaxStorageBytes() - fileRepository.sumLiveBytesByOwner(ownerId);
            allowance = Math.min(allowance, Math.max(free, 0));
        }
        return allowance;
    }

    @Transactional
    public FileRecord create(NewFile newFile, TierQuota quota) {
        String name = sanitizeName(newFile.getOriginalFilename());
        validate(newFile.getOwnerId(), name, newFile.getSize(), quota);

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiry = newFile.getExpiryPolicy().expiryFrom(now);
        if (!expiry.isAfter(now)) {
            throw new IllegalArgumentException("Expiry must be after creation");
        }

        FileRecord record = FileRecord.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(newFile.getOwnerId())
                .originalFilename(name)
                .contentType(newFile.getContentType() != null ? newFile.getContentType() : "application/octet-stream")
                .size(newFile.getSize())
                .storageName(newFile.getStorageName())
                .contentHash(newFile.getContentHash())
                .sourceUrl(newFile.getSourceUrl())
                .downloadCount(0)
                .createdAt(now)
                .expiryTime(expiry)
                .updatedAt(now)
                .build();
        FileRecord saved = fileRepository.save(record);

        auditService.record(AuditAction.FILE_REGISTERED, saved.getId(), saved.getOwnerId(), name);
        log.info("Registered file {} ({} bytes) for user {}, expires {}", saved.getId(), saved.getSize(),
                saved.getOwnerId(), expiry);
        return saved;
    }

    public FileRecord get(String fileId) {
        return fileRepository.findById(fileId)
                .orElseThrow(() -> FileLinkException.notFound("File " + fileId));
    }

    /**
     * Live files of the owner, newest first, loaded page by page as the stream is consumed.
     * Each call starts a fresh snapshot.
     */
    public Stream<FileRecord> listByOwner(long ownerId, String searchTerm) {
        String term = searchTerm == null ? "" : searchTerm.trim();
        Pageable first = PageRequest.of(0, PAGE_SIZE);
        return Stream.iterate(fetchPage(ownerId, term, first),
                        slice -> slice != null,
                        slice -> slice.hasNext() ? fetchPage(ownerId, term, slice.nextPageable()) : null)
                .flatMap(slice -> slice.getContent().stream());
    }

    private Slice<FileRecord> fetchPage(long ownerId, String term, Pageable pageable) {
        if (term.isEmpty()) {
            return fileRepository.findByOwnerIdAndDeletedFalseOrderByCreatedAtDesc(ownerId, pageable);
        }
        return fileRepository.findByOwnerIdAndDeletedFalseAndOriginalFilenameContainingIgnoreCaseOrderByCreatedAtDesc(
                ownerId, term, pageable);
    }

    /**
     * Marks the file deleted. Its link stops resolving at once; the bytes are removed by
     * the sweeper later. Deleting an already deleted file succeeds.
     */
    @Transactional
    public DeleteOutcome softDelete(String fileId, Requester requester) {
        checkNotBlocked(requester);
        FileRecord file = get(fileId);
        checkAccess(file, requester);

        int changed = fileRepository.softDelete(fileId, LocalDateTime.now(clock));
        if (changed == 0) {
            log.debug("File {} was already deleted", fileId);
            return DeleteOutcome.ALREADY_DELETED;
        }
        auditService.record(AuditAction.FILE_DELETED, fileId, file.getOwnerId(),
                requester.isAdmin() ? "by administrator " + requester.getUserId() : "by owner");
        log.info("File {} deleted by {} {}", fileId, requester.isAdmin() ? "admin" : "user", requester.getUserId());
        return DeleteOutcome.DELETED;
    }

    /**
     * Deletes every listed file the requester may delete. Unknown ids and files of other
     * owners are skipped.
     *
     * @return number of files this call deleted
     */
    @Transactional
    public int softDeleteAll(Collection<String> fileIds, Requester requester) {
        if (fileIds == null || fileIds.isEmpty()) {
            throw new IllegalArgumentException("No files given");
        }
        if (fileIds.size() > MAX_BULK_DELETE) {
            throw new IllegalArgumentException("At most " + MAX_BULK_DELETE + " files per request");
        }
        checkNotBlocked(requester);

        LocalDateTime now = LocalDateTime.now(clock);
        int deleted = 0;
        for (String fileId : new LinkedHashSet<>(fileIds)) {
            Optional<FileRecord> file = fileRepository.findById(fileId);
            if (file.isEmpty() || !(requester.isAdmin() || file.get().isOwnedBy(requester.getUserId()))) {
                log.debug("Bulk delete by {} skips file {}", requester.getUserId(), fileId);
                continue;
            }
            if (fileRepository.softDelete(fileId, now) > 0) {
                auditService.record(AuditAction.FILE_DELETED, fileId, file.get().getOwnerId(),
                        requester.isAdmin() ? "bulk, by administrator " + requester.getUserId() : "bulk, by owner");
                deleted++;
            }
        }
        log.info("Bulk delete by {} {}: {} of {} file(s) deleted", requester.isAdmin() ? "admin" : "user",
                requester.getUserId(), deleted, fileIds.size());
        return deleted;
    }

    @Transactional
    public void recordDownload(String fileId) {
        fileRepository.incrementDownloadCount(fileId);
    }

    /**
     * A live record holding the same bytes whose expiry is far enough away that it cannot be
     * swept while a new record joining its storage is being committed.
     */
    public Optional<FileRecord> findShareableCopy(String contentHash) {
        if (contentHash == null) {
            return Optional.empty();
        }
        LocalDateTime notBefore = LocalDateTime.now(clock).plus(DEDUP_MIN_REMAINING);
        return fileRepository.findFirstByContentHashAndDeletedFalseAndExpiryTimeAfter(contentHash, notBefore);
    }

    /**
     * Locks the candidate found by {@link #findShareableCopy} and returns it if it is still
     * live and far from expiry. While the lock is held the record cannot be deleted, so its
     * bytes cannot be purged before the caller's new record is committed.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<FileRecord> lockShareableCopy(String fileId) {
        LocalDateTime notBefore = LocalDateTime.now(clock).plus(DEDUP_MIN_REMAINING);
        return fileRepository.findByIdForUpdate(fileId)
                .filter(f -> !f.isDeleted() && f.getExpiryTime().isAfter(notBefore));
    }

    public Page<FileRecord> search(String term, Pageable pageable) {
        return fileRepository.search(term == null ? "" : term.trim(), pageable);
    }

    public long countLiveFiles(long ownerId) {
        return fileRepository.countByOwnerIdAndDeletedFalse(ownerId);
    }

    public long usedBytes(long ownerId) {
        return fileRepository.sumLiveBytesByOwner(ownerId);
    }

    void checkNotBlocked(Requester requester) {
        if (!requester.isAdmin()) {
            userRegistry.ensureNotBlocked(requester.getUserId());
        }
    }

    void checkAccess(FileRecord file, Requester requester) {
        if (!requester.isAdmin() && !file.isOwnedBy(requester.getUserId())) {
            throw FileLinkException.ownerMismatch(file.getId(), requester.getUserId());
        }
    }

    private long maxFileSize(TierQuota quota) {
        long hardCap = properties.getStorage().getMaxFileSize();
        return quota.getMaxFileSize() > 0 ? Math.min(hardCap, quota.getMaxFileSize()) : hardCap;
    }

    void checkExtension(String name) {
        String extension = extensionOf(name);
        Set<String> blocked = settings.blockedExtensions();
        if (!extension.isEmpty() && blocked.contains(extension)) {
            throw new FileLinkException(DenialReason.EXTENSION_BLOCKED, "Extension " + extension + " is blocked");
        }
        Set<String> allowed = settings.allowedExtensions();
        if (!allowed.isEmpty() && !allowed.contains(extension)) {
            throw new FileLinkException(DenialReason.EXTENSION_BLOCKED,
                    "Extension " + (extension.isEmpty() ? "(none)" : extension) + " is not allowed");
        }
    }

    static String extensionOf(String name) {
        if (name == null) {
            return "";
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    // Keeps the last path segment only, so a name can never point outside its folder
    static String sanitizeName(String name) {
        if (name == null) {
            return "file";
        }
        String cleaned = name.replace('\\', '/');
        cleaned = cleaned.substring(cleaned.lastIndexOf('/') + 1).replaceAll("[\\p{Cntrl}]", "").trim();
        if (cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("..")) {
            return "file";
        }
        return cleaned.length() > MAX_NAME_LENGTH ? cleaned.substring(cleaned.length() - MAX_NAME_LENGTH) : cleaned;
    }
}
