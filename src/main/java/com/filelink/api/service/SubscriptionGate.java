package com.filelink.api.service;

import com.filelink.api.client.ChannelMembershipChecker;
import com.filelink.api.client.ChannelMembershipChecker.Membership;
import com.filelink.api.config.FileLinkProperties;
import com.filelink.api.config.FileLinkProperties.TierQuota;
import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import com.filelink.api.model.ActionClass;
import com.filelink.api.model.SubscriptionStatus;
import com.filelink.api.model.SubscriptionTier;
import com.filelink.api.model.UserAccount;
import com.filelink.api.settings.SettingsService;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Decides whether a user may act right now.
 *
 * <p>State is derived from the stored timestamps on every call: trial end is
 * {@code trialStartedAt + TRIAL_DAYS} with the live setting, paid access ends at
 * {@code subscriptionExpiry} (null meaning lifetime). The stored
 * {@link SubscriptionStatus} is only a marker kept in step with that derivation.
 */
@Slf4j
@Service
public class SubscriptionGate {

    @Value
    public static class Grant {
        SubscriptionTier tier;
        boolean onTrial;
        TierQuota quota;
    }

    private final UserRegistry userRegistry;
    private final ChannelMembershipChecker membershipChecker;
    private final SettingsService settings;
    private final FileLinkProperties properties;
    private final Clock clock;

    public SubscriptionGate(UserRegistry userRegistry,
                            ChannelMembershipChecker membershipChecker,
                            SettingsService settings,
                            FileLinkProperties properties,
                            Clock clock) {
        this.userRegistry = userRegistry;
        this.membershipChecker = membershipChecker;
        this.settings = settings;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Loads the user fresh and checks block state, channel membership and subscription,
     * in that order.
     */
    public Grant authorize(long userId, ActionClass action) {
        UserAccount user = userRegistry.get(userId);
        LocalDateTime now = LocalDateTime.now(clock);

        // 1. Blocked users never get further
        if (user.isBlockedAt(now)) {
            throw UserRegistry.blockedError(user);
        }

        // 2. Required channel, fail closed
        Optional<String> channel = settings.requiredChannel();
        if (channel.isPresent()) {
            Membership membership = membershipChecker.check(userId, channel.get());
            if (membership != Membership.MEMBER) {
                throw new FileLinkException(DenialReason.CHANNEL_MEMBERSHIP_REQUIRED,
                        "User " + userId + " must join " + channel.get() + " (lookup: " + membership + ")");
            }
        }

        // 3. Subscription, evaluated lazily
        boolean trialActive = isTrialActive(user, now);
        boolean paidActive = isPaidActive(user, now);

        if (!trialActive && !paidActive) {
            if (userRegistry.markSubscriptionStatus(userId, SubscriptionStatus.EXPIRED)) {
                log.info("Subscription of user {} ({}) expired", userId, user.getTier());
            }
            throw new FileLinkException(DenialReason.SUBSCRIPTION_EXPIRED,
                    "Subscription of user " + userId + " has expired");
        }

        if (user.getSubscriptionStatus() == SubscriptionStatus.EXPIRED
                && userRegistry.markSubscriptionStatus(userId, SubscriptionStatus.ACTIVE)) {
            log.info("Subscription of user {} is active again", userId);
        }

        log.debug("User {} authorized for {}", userId, action);
        return paidActive
                ? new Grant(user.getTier(), false, quotaFor(user.getTier()))
                : new Grant(SubscriptionTier.TRIAL, true, quotaFor(SubscriptionTier.TRIAL));
    }

    /**
     * Quota the user is held to right now: the paid tier's while it runs, the trial's
     * otherwise.
     */
    public TierQuota effectiveQuota(UserAccount user) {
        boolean paidActive = isPaidActive(user, LocalDateTime.now(clock));
        return quotaFor(paidActive ? user.getTier() : SubscriptionTier.TRIAL);
    }

    public boolean isTrialActive(UserAccount user, LocalDateTime now) {
        return user.getTrialStartedAt() != null
                && now.isBefore(trialEndsAt(user));
    }

    public LocalDateTime trialEndsAt(UserAccount user) {
        return user.getTrialStartedAt().plusDays(settings.trialDays());
    }

    private static boolean isPaidActive(UserAccount user, LocalDateTime now) {
        if (!user.getTier().isPaid()) {
            return false;
        }
        LocalDateTime expiry = user.getSubscriptionExpiry();
        return expiry == null || now.isBefore(expiry);
    }

    public TierQuota quotaFor(SubscriptionTier tier) {
        TierQuota quota = properties.getTiers().get(tier);
        if (quota == null) {
            throw new IllegalStateException("No quota configured for tier " + tier);
        }
        return quota;
    }
}
