package com.filelink.api.repository;

import com.filelink.api.model.SubscriptionStatus;
import com.filelink.api.model.UserAccount;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface UserRepository extends JpaRepository<UserAccount, Long> {

    @Query("""
        SELECT u FROM UserAccount u
        WHERE LOWER(u.username) LIKE LOWER(CONCAT('%', :term, '%'))
           OR LOWER(u.displayName) LIKE LOWER(CONCAT('%', :term, '%'))
           OR CAST(u.id AS string) = :term
        ORDER BY u.createdAt DESC
    """)
    Page<UserAccount> search(@Param("term") String term, Pageable pageable);

    // Active users who are not blocked right now
    @Query("""
        SELECT u FROM UserAccount u
        WHERE u.active = true
          AND (u.blocked = false OR (u.blockedUntil IS NOT NULL AND u.blockedUntil <= :now))
    """)
    List<UserAccount> findReachable(@Param("now") LocalDateTime now);

    // Paid subscriptions ending before the cutoff that were not reminded yet
    @Query("""
        SELECT u FROM UserAccount u
        WHERE u.tier <> com.filelink.api.model.SubscriptionTier.TRIAL
          AND u.subscriptionStatus = :status
          AND u.subscriptionExpiry IS NOT NULL
          AND u.subscriptionExpiry > :now
          AND u.subscriptionExpiry <= :cutoff
          AND u.reminderSent = false
          AND (u.blocked = false OR (u.blockedUntil IS NOT NULL AND u.blockedUntil <= :now))
    """)
    List<UserAccount> findDueForReminder(@Param("status") SubscriptionStatus status,
                                         @Param("now") LocalDateTime now,
                                         @Param("cutoff") LocalDateTime cutoff);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE UserAccount u SET u.blocked = :blocked, u.blockReason = :reason, u.blockedUntil = :until,
                                 u.updatedAt = :now
        WHERE u.id = :id
    """)
    int updateBlocked(@Param("id") Long id, @Param("blocked") boolean blocked, @Param("reason") String reason,
                      @Param("until") LocalDateTime until, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE UserAccount u SET u.subscriptionStatus = :status, u.updatedAt = :now
        WHERE u.id = :id AND u.subscriptionStatus <> :status
    """)
    int updateSubscriptionStatus(@Param("id") Long id, @Param("status") SubscriptionStatus status,
                                 @Param("now") LocalDateTime now);

    // Starts a new counter day; no-op when the row already counts today
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE UserAccount u SET u.uploadsToday = 0, u.downloadsToday = 0, u.counterDay = :today
        WHERE u.id = :id AND (u.counterDay IS NULL OR u.counterDay <> :today)
    """)
    int rollCounterDay(@Param("id") Long id, @Param("today") LocalDate today);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserAccount u SET u.uploadsToday = u.uploadsToday + 1 WHERE u.id = :id")
    int incrementUploads(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserAccount u SET u.downloadsToday = u.downloadsToday + 1 WHERE u.id = :id")
    int incrementDownloads(@Param("id") Long id);

    // Counts the download only while today's count is below the limit
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE UserAccount u SET u.downloadsToday = u.downloadsToday + 1
        WHERE u.id = :id AND u.downloadsToday < :max
    """)
    int incrementDownloadsBelow(@Param("id") Long id, @Param("max") int max);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserAccount u SET u.reminderSent = true, u.updatedAt = :now WHERE u.id = :id")
    int markReminderSent(@Param("id") Long id, @Param("now") LocalDateTime now);
}
