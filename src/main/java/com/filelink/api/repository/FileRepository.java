package com.filelink.api.repository;

import com.filelink.api.model.FileRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface FileRepository extends JpaRepository<FileRecord, String> {

    Optional<FileRecord> findByDownloadToken(String downloadToken);

    // Holds the row until the surrounding transaction ends
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM FileRecord f WHERE f.id = :id")
    Optional<FileRecord> findByIdForUpdate(@Param("id") String id);

    Slice<FileRecord> findByOwnerIdAndDeletedFalseOrderByCreatedAtDesc(Long ownerId, Pageable pageable);

    Slice<FileRecord> findByOwnerIdAndDeletedFalseAndOriginalFilenameContainingIgnoreCaseOrderByCreatedAtDesc(
            Long ownerId, String term, Pageable pageable);

    long countByOwnerIdAndDeletedFalse(Long ownerId);

    @Query("""
        SELECT COALESCE(SUM(f.size), 0) FROM FileRecord f
        WHERE f.ownerId = :ownerId AND f.deleted = false
    """)
    long sumLiveBytesByOwner(@Param("ownerId") Long ownerId);

    // Sweeper: expired, still live, and not touched since the pass began
    @Query("""
        SELECT f FROM FileRecord f
        WHERE f.expiryTime <= :now AND f.deleted = false AND f.updatedAt < :passStart
        ORDER BY f.expiryTime ASC
    """)
    List<FileRecord> findExpiredCandidates(@Param("now") LocalDateTime now,
                                           @Param("passStart") LocalDateTime passStart,
                                           Pageable pageable);

    // Sweeper: soft-deleted rows whose bytes are still on disk
    @Query("""
        SELECT f FROM FileRecord f
        WHERE f.deleted = true AND f.purged = false AND f.updatedAt < :passStart
        ORDER BY f.updatedAt ASC
    """)
    List<FileRecord> findPurgeCandidates(@Param("passStart") LocalDateTime passStart, Pageable pageable);

    /**
     * Swaps the token of a live file in one statement, so the old and the new token are
     * never valid at the same time.
     *
     * @return number of rows changed, 0 when the file is missing or deleted
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE FileRecord f SET f.downloadToken = :token, f.updatedAt = :now
        WHERE f.id = :id AND f.deleted = false
    """)
    int replaceToken(@Param("id") String id, @Param("token") String token, @Param("now") LocalDateTime now);

    /**
     * The token stays on the row so administrators can tell a deleted link from an
     * unknown one; the deleted flag alone makes it unusable.
     *
     * @return 1 if this call deleted the file, 0 if it was already deleted or missing
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE FileRecord f SET f.deleted = true, f.deletedAt = :now, f.updatedAt = :now
        WHERE f.id = :id AND f.deleted = false
    """)
    int softDelete(@Param("id") String id, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE FileRecord f SET f.purged = true, f.updatedAt = :now
        WHERE f.id = :id AND f.deleted = true AND f.purged = false
    """)
    int markPurged(@Param("id") String id, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE FileRecord f SET f.downloadCount = f.downloadCount + 1
        WHERE f.id = :id AND f.deleted = false
    """)
    int incrementDownloadCount(@Param("id") String id);

    boolean existsByStorageName(String storageName);

    // Other records still holding the same deduplicated bytes
    long countByStorageNameAndPurgedFalseAndIdNot(String storageName, String id);

    // Dedup source: a live record with the same bytes that will not expire soon
    Optional<FileRecord> findFirstByContentHashAndDeletedFalseAndExpiryTimeAfter(String contentHash,
                                                                                 LocalDateTime notBefore);

    @Query("""
        SELECT f FROM FileRecord f
        WHERE LOWER(f.originalFilename) LIKE LOWER(CONCAT('%', :term, '%')) OR f.id = :term
        ORDER BY f.createdAt DESC
    """)
    Page<FileRecord> search(@Param("term") String term, Pageable pageable);
}
