package com.filelink.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.filelink.api.config.FileLinkProperties.TierQuota;
import com.filelink.api.model.SubscriptionStatus;
import com.filelink.api.model.SubscriptionTier;
import com.filelink.api.model.UserAccount;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserView {

    long id;
    String username;
    String displayName;
    SubscriptionTier tier;
    SubscriptionStatus subscriptionStatus;
    LocalDateTime subscriptionExpiry;
    LocalDateTime trialStartedAt;
    boolean blocked;
    String blockReason;
    LocalDateTime blockedUntil;
    int uploadsToday;
    int downloadsToday;
    LocalDateTime createdAt;

    // Filled in for the user's own view
    Boolean onTrial;
    LocalDateTime trialEndsAt;
    Long filesStored;
    Long bytesStored;
    TierQuota quota;

    public static UserView from(UserAccount user) {
        return UserView.builder()
                .id(user.getId())
                .username(user.getUsername())
                .displayName(user.getDisplayName())
                .tier(user.getTier())
                .subscriptionStatus(user.getSubscriptionStatus())
                .subscriptionExpiry(user.getSubscriptionExpiry())
                .trialStartedAt(user.getTrialStartedAt())
                .blocked(user.isBlocked())
                .blockReason(user.getBlockReason())
                .blockedUntil(user.getBlockedUntil())
                .uploadsToday(user.getUploadsToday())
                .downloadsToday(user.getDownloadsToday())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
