package com.filelink.api.service;

import com.filelink.api.config.FileLinkProperties;
import com.filelink.api.model.AuditAction;
import com.filelink.api.model.FileRecord;
import com.filelink.api.repository.FileRepository;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The janitor. Expires files whose time is up, removes bytes of deleted files and clears
 * files on the volume that no record knows about.
 *
 * <p>A record only counts as expired by the pass that flipped its deleted flag, so running
 * a pass twice never writes a second {@code FILE_EXPIRED} audit record. Storage failures
 * leave the record soft-deleted and unpurged; a later pass retries.
 */
@Slf4j
@Service
public class FileCleanupService {

    @Value
    public static class SweepResult {
        int expired;
        int purged;
        int failed;
    }

    private final FileRepository fileRepository;
    private final StorageService storageService;
    private final AuditService auditService;
    private final FileLinkProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public FileCleanupService(FileRepository fileRepository,
                              StorageService storageService,
                              AuditService auditService,
                              FileLinkProperties properties,
                              PlatformTransactionManager transactionManager,
                              Clock clock) {
        this.fileRepository = fileRepository;
        this.storageService = storageService;
        this.auditService = auditService;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${filelink.sweeper.interval-ms:60000}",
            initialDelayString = "${filelink.sweeper.initial-delay-ms:30000}")
    public void scheduledSweep() {
        SweepResult result = sweep();
        if (result.getExpired() > 0 || result.getPurged() > 0 || result.getFailed() > 0) {
            log.info("Janitor pass: {} expired, {} purged, {} left for retry",
                    result.getExpired(), result.getPurged(), result.getFailed());
        }
    }

    public SweepResult sweep() {
        LocalDateTime passStart = LocalDateTime.now(clock);
        int batchSize = Math.max(properties.getSweeper().getBatchSize(), 1);
        int expired = 0;
        int purged = 0;
        int failed = 0;

        // 1. Expired and still live
        Set<String> attempted = new HashSet<>();
        while (true) {
            List<FileRecord> batch = fileRepository.findExpiredCandidates(passStart, passStart, PageRequest.of(0, batchSize));
            if (!attempted.addAll(batch.stream().map(FileRecord::getId).toList())) {
                break; // empty, or nothing new since the last batch
            }
            for (FileRecord file : batch) {
                try {
                    if (!expire(file)) {
                        continue; // deleted by someone else meanwhile
                    }
                    expired++;
                    if (purge(file)) {
                        purged++;
                    } else {
                        failed++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Janitor could not expire file {}", file.getId(), e);
                }
            }
        }

        // 2. Deleted earlier, bytes still there
        attempted.clear();
        while (true) {
            List<FileRecord> batch = fileRepository.findPurgeCandidates(passStart, PageRequest.of(0, batchSize));
            if (!attempted.addAll(batch.stream().map(FileRecord::getId).toList())) {
                break;
            }
            for (FileRecord file : batch) {
                try {
                    if (purge(file)) {
                        purged++;
                    } else {
                        failed++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Janitor could not purge file {}", file.getId(), e);
                }
            }
        }
        return new SweepResult(expired, purged, failed);
    }

    private boolean expire(FileRecord file) {
        Boolean changed = transactionTemplate.execute(status -> {
            if (fileRepository.softDelete(file.getId(), LocalDateTime.now(clock)) == 0) {
                return false;
            }
            auditService.record(AuditAction.FILE_EXPIRED, file.getId(), file.getOwnerId(),
                    "expired at " + file.getExpiryTime());
            return true;
        });
        if (Boolean.TRUE.equals(changed)) {
            log.info("Expired file {} of user {}", file.getId(), file.getOwnerId());
            return true;
        }
        return false;
    }

    /**
     * Removes the bytes unless another unpurged record still shares them, then marks the
     * record purged. Counting the other holders, removing the bytes and marking happen in
     * one transaction with the record locked.
     *
     * @return false if the storage refused; the record stays unpurged
     */
    private boolean purge(FileRecord file) {
        String storageName = file.getStorageName();
        Boolean done = transactionTemplate.execute(status -> {
            if (fileRepository.findByIdForUpdate(file.getId()).filter(FileRecord::isPurged).isPresent()) {
                return true;
            }
            boolean shared = fileRepository.countByStorageNameAndPurgedFalseAndIdNot(storageName, file.getId()) > 0;
            if (!shared) {
                try {
                    storageService.delete(storageName);
                } catch (IOException e) {
                    log.warn("Janitor could not remove bytes of file {} ({}), retrying next pass: {}",
                            file.getId(), storageName, e.getMessage());
                    status.setRollbackOnly();
                    return false;
                }
            }
            if (fileRepository.markPurged(file.getId(), LocalDateTime.now(clock)) > 0) {
                auditService.record(AuditAction.FILE_PURGED, file.getId(), file.getOwnerId(),
                        shared ? "shared bytes kept" : "bytes removed");
            }
            return true;
        });
        return Boolean.TRUE.equals(done);
    }

    /**
     * Deletes files on the volume that no record references, once they are older than the
     * grace period. Hidden files are left alone.
     *
     * @return number of files removed
     */
    @Scheduled(fixedDelayString = "${filelink.sweeper.orphan-interval-ms:3600000}",
            initialDelayString = "${filelink.sweeper.orphan-interval-ms:3600000}")
    public int cleanOrphanFiles() {
        log.debug("Janitor: checking for orphan files");
        List<Path> physicalFiles;
        try {
            physicalFiles = storageService.listStoredFiles();
        } catch (IOException e) {
            log.warn("Janitor could not list the storage directory: {}", e.getMessage());
            return 0;
        }

        Instant cutoff = clock.instant().minus(properties.getStorage().getOrphanGracePeriod());
        int removed = 0;
        for (Path file : physicalFiles) {
            String filename = file.getFileName().toString();
            if (filename.startsWith(".") || !Files.isRegularFile(file)) {
                continue;
            }
            try {
                // Recent files may belong to a registration still in flight
                if (Files.getLastModifiedTime(file).toInstant().isAfter(cutoff)) {
                    continue;
                }
                if (fileRepository.existsByStorageName(filename)) {
                    continue;
                }
                Files.deleteIfExists(file);
                removed++;
                log.info("Janitor removed orphan file {}", filename);
            } catch (IOException e) {
                log.warn("Janitor could not remove orphan file {}: {}", filename, e.getMessage());
            }
        }
        return removed;
    }
}
