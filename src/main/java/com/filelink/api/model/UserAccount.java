package com.filelink.api.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "users")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    @Id
    private Long id; // Chat platform id, assigned externally

    private String username;
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SubscriptionTier tier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SubscriptionStatus subscriptionStatus;

    // Null on a paid tier means lifetime. Not used while on trial.
    private LocalDateTime subscriptionExpiry;

    @Column(nullable = false)
    private LocalDateTime trialStartedAt;

    private boolean blocked;
    private String blockReason;

    // Null while blocked means until an administrator lifts it
    private LocalDateTime blockedUntil;

    // Users are never hard-deleted
    @Builder.Default
    private boolean active = true;

    // Rolling daily counters, reset when counterDay changes
    private int uploadsToday;
    private int downloadsToday;
    private LocalDate counterDay;

    // Reminder for the current subscription period has been delivered
    private boolean reminderSent;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Whether the user is blocked at {@code now}. A temporary block lapses on its own once
     * {@code blockedUntil} has passed.
     */
    public boolean isBlockedAt(LocalDateTime now) {
        return blocked && (blockedUntil == null || now.isBefore(blockedUntil));
    }
}
