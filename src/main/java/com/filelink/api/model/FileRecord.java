package com.filelink.api.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

@Entity
@Table(name = "files", indexes = {
        @Index(name = "idx_files_owner_created", columnList = "ownerId, createdAt"),
        @Index(name = "idx_files_expiry", columnList = "expiryTime, deleted"),
        @Index(name = "idx_files_hash", columnList = "contentHash")
})
@Data
@Builder
@NoArgsConstructor // Required by JPA
@AllArgsConstructor
public class FileRecord {

    @Id
    private String id; // Random UUID, never shown in download links

    @Column(nullable = false)
    private Long ownerId;

    @Column(nullable = false)
    private String originalFilename; // "resume.pdf"

    // The random name on disk. Several records may share it when their bytes are identical.
    @Column(nullable = false)
    private String storageName;

    private long size;
    private String contentType;

    // SHA-256 of the stored bytes, hex encoded
    private String contentHash;

    // Set when the bytes were fetched from a URL instead of uploaded
    private String sourceUrl;

    // Current capability for the download link
    @ToString.Exclude
    @Column(unique = true)
    private String downloadToken;

    private long downloadCount;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime expiryTime;

    // Touched by every mutation; the sweeper skips rows touched during its own pass
    @Column(nullable = false)
    private LocalDateTime updatedAt;

    private boolean deleted;
    private LocalDateTime deletedAt;

    // Backing bytes have been removed (or released, when shared)
    private boolean purged;

    public boolean isExpiredAt(LocalDateTime now) {
        return !now.isBefore(expiryTime);
    }

    public boolean isOwnedBy(long userId) {
        return ownerId != null && ownerId == userId;
    }
}
