package com.filelink.api.service;

import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import com.filelink.api.model.SubscriptionStatus;
import com.filelink.api.model.SubscriptionTier;
import com.filelink.api.model.UserAccount;
import com.filelink.api.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Store of chat users. Every read goes to the database; nothing is cached between calls.
 */
@Slf4j
@Service
public class UserRegistry {

    private final UserRepository userRepository;
    private final Clock clock;

    public UserRegistry(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    /**
     * Returns the user, creating a trial account on first interaction. Refreshes the
     * stored username and display name when the chat platform reports new ones.
     */
    public UserAccount getOrCreate(long userId, String username, String displayName) {
        Optional<UserAccount> existing = userRepository.findById(userId);
        if (existing.isPresent()) {
            UserAccount user = existing.get();
            if (changed(user.getUsername(), username) || changed(user.getDisplayName(), displayName)) {
                if (username != null) {
                    user.setUsername(username);
                }
                if (displayName != null) {
                    user.setDisplayName(displayName);
                }
                user.setUpdatedAt(LocalDateTime.now(clock));
                return userRepository.save(user);
            }
            return user;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        UserAccount created = UserAccount.builder()
                .id(userId)
                .username(username)
                .displayName(displayName)
                .tier(SubscriptionTier.TRIAL)
                .subscriptionStatus(SubscriptionStatus.ACTIVE)
                .trialStartedAt(now)
                .counterDay(now.toLocalDate())
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            UserAccount saved = userRepository.saveAndFlush(created);
            log.info("New user {} registered, trial started", userId);
            return saved;
        } catch (DataIntegrityViolationException e) {
            // Another request created the same user first
            return get(userId);
        }
    }

    public Optional<UserAccount> find(long userId) {
        return userRepository.findById(userId);
    }

    public UserAccount get(long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> FileLinkException.notFound("User " + userId));
    }

    public boolean isBlocked(UserAccount user) {
        return user.isBlockedAt(LocalDateTime.now(clock));
    }

    /**
     * Refuses users who are blocked right now. Unknown users are not blocked.
     */
    public void ensureNotBlocked(long userId) {
        Optional<UserAccount> user = userRepository.findById(userId);
        if (user.isPresent() && isBlocked(user.get())) {
            throw blockedError(user.get());
        }
    }

    static FileLinkException blockedError(UserAccount user) {
        String until = user.getBlockedUntil() != null ? " until " + user.getBlockedUntil() : "";
        return new FileLinkException(DenialReason.USER_BLOCKED, "User " + user.getId() + " is blocked" + until);
    }

    /**
     * Blocks the user, until {@code until} or, when it is null, until unblocked.
     *
     * @return false if the user already had exactly this block
     */
    @Transactional
    public boolean block(long userId, String reason, LocalDateTime until) {
        UserAccount user = get(userId);
        if (isBlocked(user) && Objects.equals(user.getBlockedUntil(), until)) {
            return false;
        }
        userRepository.updateBlocked(userId, true, reason, until, LocalDateTime.now(clock));
        return true;
    }

    /**
     * Clears the block, including one that already lapsed.
     *
     * @return false if there was nothing to clear
     */
    @Transactional
    public boolean unblock(long userId) {
        UserAccount user = get(userId);
        if (!user.isBlocked()) {
            return false;
        }
        userRepository.updateBlocked(userId, false, null, null, LocalDateTime.now(clock));
        return true;
    }

    @Transactional
    public UserAccount grantSubscription(long userId, SubscriptionTier tier, LocalDateTime expiry) {
        UserAccount user = get(userId);
        user.setTier(tier);
        user.setSubscriptionExpiry(expiry);
        user.setSubscriptionStatus(SubscriptionStatus.ACTIVE);
        user.setReminderSent(false);
        user.setUpdatedAt(LocalDateTime.now(clock));
        return userRepository.save(user);
    }

    @Transactional
    public boolean markSubscriptionStatus(long userId, SubscriptionStatus status) {
        return userRepository.updateSubscriptionStatus(userId, status, LocalDateTime.now(clock)) > 0;
    }

    @Transactional
    public void recordUpload(long userId) {
        userRepository.rollCounterDay(userId, today());
        userRepository.incrementUploads(userId);
    }

    /**
     * Counts one download for today unless that would go past {@code maxPerDay}. Zero or
     * less means no limit.
     *
     * @return false if today's limit was already reached
     */
    @Transactional
    public boolean tryRecordDownload(long userId, int maxPerDay) {
        userRepository.rollCounterDay(userId, today());
        if (maxPerDay <= 0) {
            return userRepository.incrementDownloads(userId) > 0;
        }
        return userRepository.incrementDownloadsBelow(userId, maxPerDay) > 0;
    }

    @Transactional
    public void markReminderSent(long userId) {
        userRepository.markReminderSent(userId, LocalDateTime.now(clock));
    }

    public List<UserAccount> findBroadcastRecipients() {
        return userRepository.findReachable(LocalDateTime.now(clock));
    }

    public List<UserAccount> findDueForReminder(LocalDateTime cutoff) {
        return userRepository.findDueForReminder(SubscriptionStatus.ACTIVE, LocalDateTime.now(clock), cutoff);
    }

    public Page<UserAccount> search(String term, Pageable pageable) {
        return userRepository.search(term == null ? "" : term.trim(), pageable);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private static boolean changed(String current, String reported) {
        return reported != null && !Objects.equals(current, reported);
    }
}
