package com.filelink.api.service;

import com.filelink.api.config.FileLinkProperties.TierQuota;
import com.filelink.api.exception.FileLinkException;
import com.filelink.api.exception.LinkUnavailableException;
import com.filelink.api.exception.RateLimitedException;
import com.filelink.api.model.ActionClass;
import com.filelink.api.model.FileRecord;
import com.filelink.api.model.UserAccount;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Turns a download token into a byte stream, or a denial.
 */
@Slf4j
@Service
public class DownloadService {

    @Value
    public static class Download {
        FileRecord file;
        Resource resource;
    }

    private final LinkIssuer linkIssuer;
    private final FileRegistry fileRegistry;
    private final UserRegistry userRegistry;
    private final SubscriptionGate subscriptionGate;
    private final RateLimiter rateLimiter;
    private final StorageService storageService;

    public DownloadService(LinkIssuer linkIssuer,
                           FileRegistry fileRegistry,
                           UserRegistry userRegistry,
                           SubscriptionGate subscriptionGate,
                           RateLimiter rateLimiter,
                           StorageService storageService) {
        this.linkIssuer = linkIssuer;
        this.fileRegistry = fileRegistry;
        this.userRegistry = userRegistry;
        this.subscriptionGate = subscriptionGate;
        this.rateLimiter = rateLimiter;
        this.storageService = storageService;
    }

    public Download open(String token) {
        // 1. Check the link (deleted, expired, unknown all look the same from outside)
        FileRecord file = linkIssuer.resolve(token);

        // 2. Links of blocked owners are dead too
        UserAccount owner = userRegistry.get(file.getOwnerId());
        if (userRegistry.isBlocked(owner)) {
            throw new LinkUnavailableException(LinkUnavailableException.Cause.OWNER_BLOCKED, file.getId());
        }

        // 3. Per-owner rate limit. A throttled link answers like a dead one so callers
        // cannot guess which tokens exist.
        try {
            rateLimiter.admit(owner.getId(), ActionClass.FILE_DOWNLOAD);
        } catch (RateLimitedException e) {
            throw new LinkUnavailableException(LinkUnavailableException.Cause.OWNER_RATE_LIMITED, file.getId());
        }

        // 4. Load the actual bytes
        Resource resource;
        try {
            resource = storageService.loadAsResource(file.getStorageName());
        } catch (IOException e) {
            log.error("Bytes of live file {} are missing ({})", file.getId(), file.getStorageName());
            throw FileLinkException.storageFailure("Stored file unavailable", e);
        }

        // 5. Count it, within the owner's daily quota
        TierQuota quota = subscriptionGate.effectiveQuota(owner);
        if (!userRegistry.tryRecordDownload(owner.getId(), quota.getMaxDownloadsPerDay())) {
            log.info("Daily download limit of user {} reached", owner.getId());
            throw new LinkUnavailableException(LinkUnavailableException.Cause.OWNER_QUOTA_EXCEEDED, file.getId());
        }
        fileRegistry.recordDownload(file.getId());
        log.debug("Serving file {} via token {}", file.getId(), TokenGenerator.mask(token));
        return new Download(file, resource);
    }
}
