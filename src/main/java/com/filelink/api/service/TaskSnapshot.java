package com.filelink.api.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.filelink.api.exception.DenialReason;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * State of a background download at one point in time.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskSnapshot {

    String taskId;
    long ownerId;
    String url;
    FetchTaskStatus status;
    LocalDateTime createdAt;
    LocalDateTime startedAt;
    LocalDateTime finishedAt;

    // Set once completed
    String fileId;
    String downloadUrl;

    // Set once failed
    DenialReason errorReason;
    String error;
}
