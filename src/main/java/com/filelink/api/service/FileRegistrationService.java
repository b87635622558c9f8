package com.filelink.api.service;

import com.filelink.api.client.RemoteFileFetcher;
import com.filelink.api.config.FileLinkProperties;
import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import com.filelink.api.model.ActionClass;
import com.filelink.api.model.FileRecord;
import com.filelink.api.settings.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Registration of new files, from an upload or from a URL.
 *
 * <p>Order: rate limit, user, gate, pre-write validation, bytes, then record and token in
 * one transaction. Bytes written for a request that fails later are removed again, so a
 * failed registration leaves neither a record nor a file behind.
 */
@Slf4j
@Service
public class FileRegistrationService {

    private static final String FALLBACK_NAME = "download";

    private final RateLimiter rateLimiter;
    private final UserRegistry userRegistry;
    private final SubscriptionGate subscriptionGate;
    private final FileRegistry fileRegistry;
    private final LinkIssuer linkIssuer;
    private final StorageService storageService;
    private final RemoteFileFetcher remoteFileFetcher;
    private final UrlPolicy urlPolicy;
    private final SettingsService settings;
    private final FileLinkProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public FileRegistrationService(RateLimiter rateLimiter,
                                   UserRegistry userRegistry,
                                   SubscriptionGate subscriptionGate,
                                   FileRegistry fileRegistry,
                                   LinkIssuer linkIssuer,
                                   StorageService storageService,
                                   RemoteFileFetcher remoteFileFetcher,
                                   UrlPolicy urlPolicy,
                                   SettingsService settings,
                                   FileLinkProperties properties,
                                   PlatformTransactionManager transactionManager,
                                   Clock clock) {
        this.rateLimiter = rateLimiter;
        this.userRegistry = userRegistry;
        this.subscriptionGate = subscriptionGate;
        this.fileRegistry = fileRegistry;
        this.linkIssuer = linkIssuer;
        this.storageService = storageService;
        this.remoteFileFetcher = remoteFileFetcher;
        this.urlPolicy = urlPolicy;
        this.settings = settings;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public Registration registerUpload(RegistrationRequest request, InputStream content) {
        SubscriptionGate.Grant grant = admit(request);
        String name = FileRegistry.sanitizeName(request.getFileName());
        ExpiryPolicy expiry = expiryFor(request);

        // Checked against the declared size first, the stream enforces the real one
        fileRegistry.validate(request.getOwnerId(), name, Math.max(request.getDeclaredSize(), 0), grant.getQuota());
        long allowance = fileRegistry.remainingAllowance(request.getOwnerId(), grant.getQuota());

        StoredObject stored = storageService.store(content, allowance, deadline());
        return complete(request, grant, name, request.getContentType(), null, expiry, stored);
    }

    public Registration registerFromUrl(RegistrationRequest request, String url) {
        SubscriptionGate.Grant grant = admit(request);
        URI uri = urlPolicy.check(url);
        String name = FileRegistry.sanitizeName(
                request.getFileName() != null && !request.getFileName().isBlank()
                        ? request.getFileName()
                        : nameFromUri(uri));
        ExpiryPolicy expiry = expiryFor(request);

        fileRegistry.validate(request.getOwnerId(), name, 0, grant.getQuota());
        long allowance = fileRegistry.remainingAllowance(request.getOwnerId(), grant.getQuota());
        Instant deadline = deadline();

        FetchedFile fetched = remoteFileFetcher.fetch(uri, (body, contentLength, contentType) -> {
            // Refuse early when the server announces too much
            if (contentLength > allowance) {
                throw new FileLinkException(DenialReason.SIZE_TOO_LARGE,
                        "Remote file of " + contentLength + " bytes exceeds the allowance of " + allowance + " bytes");
            }
            return new FetchedFile(storageService.store(body, allowance, deadline), contentType);
        });

        String contentType = request.getContentType() != null ? request.getContentType() : fetched.contentType;
        log.info("Fetched {} bytes from {} for user {}", fetched.stored.getSize(), uri.getHost(), request.getOwnerId());
        return complete(request, grant, name, contentType, uri.toString(), expiry, fetched.stored);
    }

    private SubscriptionGate.Grant admit(RegistrationRequest request) {
        rateLimiter.admit(request.getOwnerId(), ActionClass.UPLOAD);
        userRegistry.getOrCreate(request.getOwnerId(), request.getUsername(), request.getDisplayName());
        return subscriptionGate.authorize(request.getOwnerId(), ActionClass.UPLOAD);
    }

    private Registration complete(RegistrationRequest request,
                                  SubscriptionGate.Grant grant,
                                  String name,
                                  String contentType,
                                  String sourceUrl,
                                  ExpiryPolicy expiry,
                                  StoredObject stored) {
        String ownStorageName = stored.getStorageName();
        Optional<FileRecord> candidate = fileRegistry.findShareableCopy(stored.getContentHash());

        Registration registration;
        try {
            registration = transactionTemplate.execute(status -> {
                // The copy may have been deleted since it was found; re-checked under lock
                String storageName = candidate
                        .flatMap(copy -> fileRegistry.lockShareableCopy(copy.getId()))
                        .map(FileRecord::getStorageName)
                        .filter(storageService::exists)
                        .orElse(ownStorageName);

                NewFile newFile = NewFile.builder()
                        .ownerId(request.getOwnerId())
                        .originalFilename(name)
                        .contentType(contentType)
                        .size(stored.getSize())
                        .storageName(storageName)
                        .contentHash(stored.getContentHash())
                        .sourceUrl(sourceUrl)
                        .expiryPolicy(expiry)
                        .build();
                FileRecord file = fileRegistry.create(newFile, grant.getQuota());
                String token = linkIssuer.issue(file);
                return new Registration(file, token, linkIssuer.downloadUrl(token));
            });
        } catch (RuntimeException e) {
            release(ownStorageName);
            throw e;
        }

        String storageName = registration.getFile().getStorageName();
        if (!storageName.equals(ownStorageName)) {
            log.debug("Content of file {} already stored, sharing {}", registration.getFile().getId(), storageName);
            release(ownStorageName);
        }
        userRegistry.recordUpload(request.getOwnerId());
        return registration;
    }

    private ExpiryPolicy expiryFor(RegistrationRequest request) {
        int days = request.getExpiryDays() != null ? request.getExpiryDays() : settings.defaultExpiryDays();
        if (days < 1 || days > properties.getMaxExpiryDays()) {
            throw new IllegalArgumentException(
                    "Expiry must be between 1 and " + properties.getMaxExpiryDays() + " days");
        }
        return ExpiryPolicy.ofDays(days);
    }

    private Instant deadline() {
        return clock.instant().plus(properties.getFetch().getMaxTransferTime());
    }

    private void release(String storageName) {
        try {
            storageService.delete(storageName);
        } catch (IOException e) {
            // Left for the orphan scan
            log.warn("Could not remove unused stored file {}: {}", storageName, e.getMessage());
        }
    }

    static String nameFromUri(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty() || path.endsWith("/")) {
            return FALLBACK_NAME;
        }
        String last = path.substring(path.lastIndexOf('/') + 1);
        String decoded = URLDecoder.decode(last, StandardCharsets.UTF_8);
        return decoded.isBlank() ? FALLBACK_NAME : decoded;
    }

    private static class FetchedFile {
        private final StoredObject stored;
        private final String contentType;

        FetchedFile(StoredObject stored, String contentType) {
            this.stored = stored;
            this.contentType = contentType;
        }
    }
}
