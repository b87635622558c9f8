package com.filelink.api.service;

import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import com.filelink.api.model.ActionClass;
import com.filelink.api.settings.SettingsService;
import org.springframework.stereotype.Component;

/**
 * First check on every bot command. Administrators pass through; everybody else is held
 * back while processing is paused and is counted against the message limit.
 */
@Component
public class CommandGuard {

    private final ProcessingToggle processingToggle;
    private final RateLimiter rateLimiter;
    private final SettingsService settings;

    public CommandGuard(ProcessingToggle processingToggle, RateLimiter rateLimiter, SettingsService settings) {
        this.processingToggle = processingToggle;
        this.rateLimiter = rateLimiter;
        this.settings = settings;
    }

    public Requester admit(long userId) {
        if (settings.isAdmin(userId)) {
            return Requester.admin(userId);
        }
        if (processingToggle.isPaused()) {
            throw new FileLinkException(DenialReason.BOT_PAUSED, "Processing is paused");
        }
        rateLimiter.admit(userId, ActionClass.MESSAGE);
        return Requester.user(userId);
    }
}
