package com.filelink.api.service;

import com.filelink.api.client.ChatGateway;
import com.filelink.api.config.FileLinkProperties;
import com.filelink.api.exception.FileLinkException;
import com.filelink.api.exception.RateLimitedException;
import com.filelink.api.model.ActionClass;
import com.filelink.api.model.AuditAction;
import com.filelink.api.model.FileRecord;
import com.filelink.api.model.SubscriptionTier;
import com.filelink.api.model.UserAccount;
import com.filelink.api.settings.SettingKey;
import com.filelink.api.settings.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Operations of the admin panel. Callers are already authenticated as administrators;
 * every action is audited with {@link Requester#PANEL_ACTOR_ID} as actor.
 */
@Slf4j
@Service
public class AdminModerationService {

    private final UserRegistry userRegistry;
    private final FileRegistry fileRegistry;
    private final LinkIssuer linkIssuer;
    private final SettingsService settings;
    private final ProcessingToggle processingToggle;
    private final RateLimiter rateLimiter;
    private final ChatGateway chatGateway;
    private final AuditService auditService;
    private final ThreadPoolTaskExecutor broadcastExecutor;
    private final FetchTaskService fetchTaskService;
    private final FileLinkProperties properties;
    private final Clock clock;

    public AdminModerationService(UserRegistry userRegistry,
                                  FileRegistry fileRegistry,
                                  LinkIssuer linkIssuer,
                                  SettingsService settings,
                                  ProcessingToggle processingToggle,
                                  RateLimiter rateLimiter,
                                  ChatGateway chatGateway,
                                  AuditService auditService,
                                  @Qualifier("broadcastExecutor") ThreadPoolTaskExecutor broadcastExecutor,
                                  FetchTaskService fetchTaskService,
                                  FileLinkProperties properties,
                                  Clock clock) {
        this.userRegistry = userRegistry;
        this.fileRegistry = fileRegistry;
        this.linkIssuer = linkIssuer;
        this.settings = settings;
        this.processingToggle = processingToggle;
        this.rateLimiter = rateLimiter;
        this.chatGateway = chatGateway;
        this.auditService = auditService;
        this.broadcastExecutor = broadcastExecutor;
        this.fetchTaskService = fetchTaskService;
        this.properties = properties;
        this.clock = clock;
    }

    // ---- Users ----

    /**
     * Blocked users are refused by every gate, and links to their files stop resolving.
     *
     * @return false if the user was already blocked
     */
    public boolean blockUser(long userId, String reason) {
        return blockUser(userId, reason, null);
    }

    /**
     * Same as {@link #blockUser(long, String)}, but the block lifts by itself after
     * {@code duration}. A null duration blocks until unblocked.
     */
    public boolean blockUser(long userId, String reason, Duration duration) {
        if (duration != null && (duration.isNegative() || duration.isZero())) {
            throw new IllegalArgumentException("Block duration must be positive");
        }
        LocalDateTime until = duration != null ? LocalDateTime.now(clock).plus(duration) : null;
        boolean changed = userRegistry.block(userId, reason, until);
        if (changed) {
            String detail = until == null ? reason : (reason == null ? "" : reason + " ") + "until " + until;
            auditService.record(AuditAction.USER_BLOCKED, null, userId, detail);
            log.info("User {} blocked{}: {}", userId, until == null ? "" : " until " + until, reason);
        }
        return changed;
    }

    public boolean unblockUser(long userId) {
        boolean changed = userRegistry.unblock(userId);
        if (changed) {
            auditService.record(AuditAction.USER_UNBLOCKED, null, userId, null);
            log.info("User {} unblocked", userId);
        }
        return changed;
    }

    public Page<UserAccount> searchUsers(String term, Pageable pageable) {
        return userRegistry.search(term, pageable);
    }

    public UserAccount grantSubscription(long userId, SubscriptionTier tier, LocalDateTime expiry) {
        if (tier == null) {
            throw new IllegalArgumentException("Tier is required");
        }
        UserAccount user = userRegistry.grantSubscription(userId, tier, expiry);
        auditService.record(AuditAction.SUBSCRIPTION_GRANTED, null, userId,
                tier + (expiry == null ? " (lifetime)" : " until " + expiry));
        log.info("Granted {} to user {} until {}", tier, userId, expiry == null ? "forever" : expiry);
        return user;
    }

    // ---- Files and links ----

    public Page<FileRecord> searchFiles(String term, Pageable pageable) {
        return fileRegistry.search(term, pageable);
    }

    public FileRegistry.DeleteOutcome deleteFile(String fileId) {
        return fileRegistry.softDelete(fileId, Requester.panel());
    }

    public int deleteFiles(List<String> fileIds) {
        return fileRegistry.softDeleteAll(fileIds, Requester.panel());
    }

    // Stops every background download still queued or running
    public int cancelAllTasks() {
        return fetchTaskService.cancelAll();
    }

    public String regenerateLink(String fileId) {
        return linkIssuer.regenerate(fileId, Requester.panel());
    }

    public LinkIssuer.LinkDiagnosis inspectLink(String token) {
        return linkIssuer.inspect(token);
    }

    // ---- Settings ----

    public SettingKey updateSetting(String name, String value) {
        SettingKey key = settings.update(name, value);
        auditService.record(AuditAction.SETTING_UPDATED, null, Requester.PANEL_ACTOR_ID,
                key.isSecret() ? key.name() : key.name() + "=" + value.trim());
        return key;
    }

    public Map<String, String> listSettings() {
        return settings.listMasked();
    }

    // ---- Bot ----

    public boolean pauseBot() {
        boolean changed = processingToggle.pause();
        if (changed) {
            auditService.record(AuditAction.BOT_PAUSED, null, Requester.PANEL_ACTOR_ID, null);
            log.warn("Bot processing paused by administrator");
        }
        return changed;
    }

    public boolean resumeBot() {
        boolean changed = processingToggle.resume();
        if (changed) {
            auditService.record(AuditAction.BOT_RESUMED, null, Requester.PANEL_ACTOR_ID, null);
            log.info("Bot processing resumed by administrator");
        }
        return changed;
    }

    public boolean isPaused() {
        return processingToggle.isPaused();
    }

    /**
     * Sends {@code message} to every active, unblocked user.
     *
     * <p>The initiator is admitted once, then every recipient on its own budget. Deliveries
     * run on the broadcast executor; each gets the per-recipient timeout from the moment its
     * send starts, and is interrupted once that runs out. A failed recipient never stops the
     * others.
     *
     * @throws RateLimitedException if the initiator itself is over the limit
     */
    public BroadcastReport broadcast(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Broadcast message must not be empty");
        }
        rateLimiter.admit(Requester.PANEL_ACTOR_ID, ActionClass.BROADCAST);

        List<UserAccount> recipients = userRegistry.findBroadcastRecipients();
        long timeoutNanos = properties.getBroadcast().getPerRecipientTimeout().toNanos();
        Map<Long, String> failures = new LinkedHashMap<>();
        Map<Long, Delivery> deliveries = new LinkedHashMap<>();

        for (UserAccount recipient : recipients) {
            long id = recipient.getId();
            try {
                rateLimiter.admit(id, ActionClass.BROADCAST);
                Delivery delivery = new Delivery();
                delivery.task = broadcastExecutor.submit(() -> {
                    delivery.startedAt.complete(System.nanoTime());
                    chatGateway.sendMessage(id, message);
                });
                deliveries.put(id, delivery);
            } catch (RateLimitedException e) {
                failures.put(id, "rate limited");
            } catch (TaskRejectedException e) {
                failures.put(id, "delivery queue full");
            }
        }

        int delivered = 0;
        for (Map.Entry<Long, Delivery> entry : deliveries.entrySet()) {
            String failure = await(entry.getValue(), timeoutNanos);
            if (failure == null) {
                delivered++;
            } else {
                failures.put(entry.getKey(), failure);
            }
        }

        BroadcastReport report = new BroadcastReport(recipients.size(), delivered, failures);
        auditService.record(AuditAction.BROADCAST_SENT, null, Requester.PANEL_ACTOR_ID,
                delivered + "/" + recipients.size() + " delivered");
        log.info("Broadcast delivered to {} of {} users, {} failed", delivered, recipients.size(), failures.size());
        return report;
    }

    private static class Delivery {
        final CompletableFuture<Long> startedAt = new CompletableFuture<>();
        Future<?> task;
    }

    /**
     * @return null once delivered, otherwise why not
     */
    private static String await(Delivery delivery, long timeoutNanos) {
        try {
            long started = delivery.startedAt.get();
            long remaining = started + timeoutNanos - System.nanoTime();
            delivery.task.get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
            return null;
        } catch (TimeoutException e) {
            if (delivery.task.cancel(true)) {
                return "timed out";
            }
            // Finished while we gave up on it
            return await(delivery, timeoutNanos);
        } catch (ExecutionException e) {
            return describe(e.getCause());
        } catch (CancellationException e) {
            return "timed out";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            delivery.task.cancel(true);
            return "interrupted";
        }
    }

    private static String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        if (cause instanceof FileLinkException) {
            return ((FileLinkException) cause).getReason().getMessageKey();
        }
        return cause != null && cause.getMessage() != null ? cause.getMessage() : "delivery failed";
    }
}
