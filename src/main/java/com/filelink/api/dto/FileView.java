package com.filelink.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.filelink.api.model.FileRecord;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FileView {

    String id;
    Long ownerId;
    String fileName;
    long size;
    String contentType;
    long downloadCount;
    LocalDateTime createdAt;
    LocalDateTime expiryTime;
    boolean deleted;
    String sourceUrl;

    // Only set for the owner's own listing
    String downloadUrl;

    public static FileView from(FileRecord file, String downloadUrl) {
        return FileView.builder()
                .id(file.getId())
                .ownerId(file.getOwnerId())
                .fileName(file.getOriginalFilename())
                .size(file.getSize())
                .contentType(file.getContentType())
                .downloadCount(file.getDownloadCount())
                .createdAt(file.getCreatedAt())
                .expiryTime(file.getExpiryTime())
                .deleted(file.isDeleted())
                .sourceUrl(file.getSourceUrl())
                .downloadUrl(downloadUrl)
                .build();
    }
}
