package com.filelink.api.service;

import com.filelink.api.config.FileLinkProperties;
import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * URL registrations running in the background, so the bot can answer at once and let the
 * user follow or cancel the download.
 *
 * <p>Tasks live in memory only and are forgotten a while after they were created. A
 * cancelled task never leaves a live file behind: a transfer in flight is interrupted and
 * its bytes discarded, and a file registered just before the cancel is deleted again.
 */
@Slf4j
@Service
public class FetchTaskService {

    private final Cache<String, FetchTask> tasks;
    private final FileRegistrationService registrationService;
    private final FileRegistry fileRegistry;
    private final UrlPolicy urlPolicy;
    private final ThreadPoolTaskExecutor fetchExecutor;
    private final Clock clock;

    public FetchTaskService(FileRegistrationService registrationService,
                            FileRegistry fileRegistry,
                            UrlPolicy urlPolicy,
                            @Qualifier("fetchExecutor") ThreadPoolTaskExecutor fetchExecutor,
                            FileLinkProperties properties,
                            Clock clock) {
        this.registrationService = registrationService;
        this.fileRegistry = fileRegistry;
        this.urlPolicy = urlPolicy;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
        this.tasks = Caffeine.newBuilder()
                .expireAfterWrite(properties.getFetch().getTaskRetention())
                .maximumSize(10_000)
                .build();
    }

    /**
     * Queues the download. The URL is checked right away; rate limit, subscription and
     * quota are checked when the task runs and show up as its failure.
     *
     * @throws FileLinkException with {@link DenialReason#QUEUE_FULL} when no more work fits
     */
    public TaskSnapshot submit(RegistrationRequest request, String url) {
        urlPolicy.check(url);
        FetchTask task = new FetchTask(UUID.randomUUID().toString(), request.getOwnerId(), url, now());
        tasks.put(task.getId(), task);
        try {
            Future<?> future = fetchExecutor.submit(() -> run(task, request));
            task.attach(future);
        } catch (TaskRejectedException e) {
            tasks.invalidate(task.getId());
            throw new FileLinkException(DenialReason.QUEUE_FULL, "Download queue is full", e);
        }
        log.info("Queued download task {} for user {}", task.getId(), request.getOwnerId());
        return task.snapshot();
    }

    public TaskSnapshot get(String taskId, Requester requester) {
        return find(taskId, requester).snapshot();
    }

    // Newest first
    public List<TaskSnapshot> listByOwner(long ownerId) {
        return tasks.asMap().values().stream()
                .filter(t -> t.getOwnerId() == ownerId)
                .map(FetchTask::snapshot)
                .sorted(Comparator.comparing(TaskSnapshot::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    /**
     * @throws FileLinkException with {@link DenialReason#TASK_FINISHED} if there is nothing
     *         left to cancel
     */
    public TaskSnapshot cancel(String taskId, Requester requester) {
        FetchTask task = find(taskId, requester);
        if (!task.cancel(now())) {
            throw new FileLinkException(DenialReason.TASK_FINISHED,
                    "Task " + taskId + " already " + task.getStatus().name().toLowerCase(Locale.ROOT));
        }
        log.info("Download task {} cancelled by {}", taskId, requester.getUserId());
        return task.snapshot();
    }

    /**
     * Cancels every unfinished task of every user.
     *
     * @return number of tasks cancelled
     */
    public int cancelAll() {
        LocalDateTime now = now();
        int cancelled = 0;
        for (FetchTask task : tasks.asMap().values()) {
            if (task.cancel(now)) {
                cancelled++;
            }
        }
        log.warn("Cancelled {} download task(s)", cancelled);
        return cancelled;
    }

    private FetchTask find(String taskId, Requester requester) {
        FetchTask task = tasks.getIfPresent(taskId);
        if (task == null) {
            throw FileLinkException.notFound("Task " + taskId);
        }
        if (!requester.isAdmin() && task.getOwnerId() != requester.getUserId()) {
            throw new FileLinkException(DenialReason.OWNER_MISMATCH,
                    "Task " + taskId + " does not belong to user " + requester.getUserId());
        }
        return task;
    }

    private void run(FetchTask task, RegistrationRequest request) {
        if (!task.start(now())) {
            return; // cancelled while queued
        }
        try {
            Registration registration = registrationService.registerFromUrl(request, task.getUrl());
            if (!task.complete(registration, now())) {
                discard(task, registration);
                return;
            }
            log.info("Download task {} finished as file {}", task.getId(), registration.getFile().getId());
        } catch (FileLinkException e) {
            if (task.fail(e.getReason(), e.getMessage(), now())) {
                log.info("Download task {} failed: {}", task.getId(), e.getMessage());
            }
        } catch (RuntimeException e) {
            if (task.fail(null, "Download failed", now())) {
                log.error("Download task {} failed", task.getId(), e);
            }
        }
    }

    private void discard(FetchTask task, Registration registration) {
        // Clear the cancel interrupt so the delete can reach the database
        Thread.interrupted();
        String fileId = registration.getFile().getId();
        try {
            fileRegistry.softDelete(fileId, Requester.user(task.getOwnerId()));
            log.info("Download task {} was cancelled after registering file {}, file deleted", task.getId(), fileId);
        } catch (FileLinkException e) {
            log.warn("Could not delete file {} of cancelled task {}: {}", fileId, task.getId(), e.getMessage());
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
