package com.filelink.api.service;

import com.filelink.api.config.FileLinkProperties;
import com.filelink.api.exception.FileLinkException;
import com.filelink.api.exception.LinkUnavailableException;
import com.filelink.api.exception.LinkUnavailableException.Cause;
import com.filelink.api.model.AuditAction;
import com.filelink.api.model.FileRecord;
import com.filelink.api.repository.FileRepository;
import com.filelink.api.settings.SettingsService;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Mints, replaces and resolves download tokens.
 *
 * <p>A file holds exactly one token column. Replacing it is a single conditional
 * {@code UPDATE}, so once {@link #regenerate} returns the previous token resolves to
 * nothing for every later request.
 */
@Slf4j
@Service
public class LinkIssuer {

    public enum LinkStatus {
        VALID,
        EXPIRED,
        DELETED,
        OWNER_BLOCKED,
        NEVER_EXISTED
    }

    @Value
    public static class LinkDiagnosis {
        LinkStatus status;
        String fileId;
        Long ownerId;
        LocalDateTime expiryTime;
    }

    private final FileRepository fileRepository;
    private final FileRegistry fileRegistry;
    private final UserRegistry userRegistry;
    private final TokenGenerator tokenGenerator;
    private final AuditService auditService;
    private final SettingsService settings;
    private final FileLinkProperties properties;
    private final Clock clock;

    public LinkIssuer(FileRepository fileRepository,
                      FileRegistry fileRegistry,
                      UserRegistry userRegistry,
                      TokenGenerator tokenGenerator,
                      AuditService auditService,
                      SettingsService settings,
                      FileLinkProperties properties,
                      Clock clock) {
        this.fileRepository = fileRepository;
        this.fileRegistry = fileRegistry;
        this.userRegistry = userRegistry;
        this.tokenGenerator = tokenGenerator;
        this.auditService = auditService;
        this.settings = settings;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public String issue(FileRecord file) {
        String token = tokenGenerator.newToken();
        if (fileRepository.replaceToken(file.getId(), token, LocalDateTime.now(clock)) == 0) {
            throw FileLinkException.notFound("File " + file.getId());
        }
        file.setDownloadToken(token);
        log.debug("Issued token {} for file {}", TokenGenerator.mask(token), file.getId());
        return token;
    }

    @Transactional
    public String regenerate(String fileId, Requester requester) {
        fileRegistry.checkNotBlocked(requester);
        FileRecord file = fileRegistry.get(fileId);
        if (file.isDeleted()) {
            throw FileLinkException.notFound("File " + fileId);
        }
        fileRegistry.checkAccess(file, requester);

        String token = tokenGenerator.newToken();
        // Deleted between the read and the write: nothing to regenerate
        if (fileRepository.replaceToken(fileId, token, LocalDateTime.now(clock)) == 0) {
            throw FileLinkException.notFound("File " + fileId);
        }
        auditService.record(AuditAction.LINK_REGENERATED, fileId, file.getOwnerId(),
                requester.isAdmin() ? "by administrator " + requester.getUserId() : "by owner");
        log.info("Link for file {} regenerated ({} -> {})", fileId,
                TokenGenerator.mask(file.getDownloadToken()), TokenGenerator.mask(token));
        return token;
    }

    /**
     * @throws LinkUnavailableException for unknown, expired and deleted links alike; the
     *         diagnostic cause is only meant for administrators
     */
    public FileRecord resolve(String token) {
        if (token == null || token.isBlank()) {
            throw new LinkUnavailableException(Cause.NEVER_EXISTED, null);
        }
        FileRecord file = fileRepository.findByDownloadToken(token)
                .orElseThrow(() -> new LinkUnavailableException(Cause.NEVER_EXISTED, null));
        if (file.isDeleted()) {
            throw new LinkUnavailableException(Cause.DELETED, file.getId());
        }
        if (file.isExpiredAt(LocalDateTime.now(clock))) {
            throw new LinkUnavailableException(Cause.EXPIRED, file.getId());
        }
        return file;
    }

    public LinkDiagnosis inspect(String token) {
        try {
            FileRecord file = resolve(token);
            boolean ownerBlocked = userRegistry.find(file.getOwnerId()).map(userRegistry::isBlocked).orElse(false);
            return new LinkDiagnosis(ownerBlocked ? LinkStatus.OWNER_BLOCKED : LinkStatus.VALID,
                    file.getId(), file.getOwnerId(), file.getExpiryTime());
        } catch (LinkUnavailableException e) {
            if (e.getFileId() == null) {
                return new LinkDiagnosis(LinkStatus.NEVER_EXISTED, null, null, null);
            }
            FileRecord file = fileRegistry.get(e.getFileId());
            LinkStatus status = e.getDiagnosticCause() == Cause.DELETED ? LinkStatus.DELETED : LinkStatus.EXPIRED;
            return new LinkDiagnosis(status, file.getId(), file.getOwnerId(), file.getExpiryTime());
        }
    }

    public String downloadUrl(String token) {
        return properties.getDownloadScheme() + "://" + settings.downloadDomain() + "/d/" + token;
    }
}
