package com.filelink.api.service;

import com.filelink.api.exception.DenialReason;

import java.time.LocalDateTime;
import java.util.concurrent.Future;

/**
 * One background URL download. Status changes only move forward:
 * PENDING to RUNNING to COMPLETED or FAILED, and to CANCELLED from any unfinished state.
 */
class FetchTask {

    private final String id;
    private final long ownerId;
    private final String url;
    private final LocalDateTime createdAt;

    private FetchTaskStatus status = FetchTaskStatus.PENDING;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private String fileId;
    private String downloadUrl;
    private DenialReason errorReason;
    private String error;
    private Future<?> future;

    FetchTask(String id, long ownerId, String url, LocalDateTime createdAt) {
        this.id = id;
        this.ownerId = ownerId;
        this.url = url;
        this.createdAt = createdAt;
    }

    String getId() {
        return id;
    }

    long getOwnerId() {
        return ownerId;
    }

    String getUrl() {
        return url;
    }

    synchronized FetchTaskStatus getStatus() {
        return status;
    }

    synchronized void attach(Future<?> future) {
        this.future = future;
        if (status == FetchTaskStatus.CANCELLED) {
            future.cancel(true);
        }
    }

    synchronized boolean start(LocalDateTime now) {
        if (status != FetchTaskStatus.PENDING) {
            return false;
        }
        status = FetchTaskStatus.RUNNING;
        startedAt = now;
        return true;
    }

    synchronized boolean complete(Registration registration, LocalDateTime now) {
        if (status != FetchTaskStatus.RUNNING) {
            return false;
        }
        status = FetchTaskStatus.COMPLETED;
        finishedAt = now;
        fileId = registration.getFile().getId();
        downloadUrl = registration.getDownloadUrl();
        return true;
    }

    synchronized boolean fail(DenialReason reason, String message, LocalDateTime now) {
        if (status != FetchTaskStatus.RUNNING) {
            return false;
        }
        status = FetchTaskStatus.FAILED;
        finishedAt = now;
        errorReason = reason;
        error = message;
        return true;
    }

    /**
     * Interrupts the worker if the download is already running.
     *
     * @return false if the task had already finished
     */
    synchronized boolean cancel(LocalDateTime now) {
        if (status.isFinished()) {
            return false;
        }
        status = FetchTaskStatus.CANCELLED;
        finishedAt = now;
        if (future != null) {
            future.cancel(true);
        }
        return true;
    }

    synchronized TaskSnapshot snapshot() {
        return TaskSnapshot.builder()
                .taskId(id)
                .ownerId(ownerId)
                .url(url)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .fileId(fileId)
                .downloadUrl(downloadUrl)
                .errorReason(errorReason)
                .error(error)
                .build();
    }
}
