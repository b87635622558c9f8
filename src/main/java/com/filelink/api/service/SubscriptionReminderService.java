package com.filelink.api.service;

import com.filelink.api.client.ChatGateway;
import com.filelink.api.model.UserAccount;
import com.filelink.api.settings.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Reminds paid users once per subscription period that their access ends soon.
 */
@Slf4j
@Service
public class SubscriptionReminderService {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final UserRegistry userRegistry;
    private final ChatGateway chatGateway;
    private final SettingsService settings;
    private final Clock clock;

    public SubscriptionReminderService(UserRegistry userRegistry,
                                       ChatGateway chatGateway,
                                       SettingsService settings,
                                       Clock clock) {
        this.userRegistry = userRegistry;
        this.chatGateway = chatGateway;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * @return number of reminders delivered
     */
    @Scheduled(cron = "${filelink.reminder.cron:0 0 9 * * *}")
    public int sendReminders() {
        LocalDateTime cutoff = LocalDateTime.now(clock).plusDays(settings.reminderDays());
        List<UserAccount> due = userRegistry.findDueForReminder(cutoff);
        int sent = 0;
        for (UserAccount user : due) {
            try {
                chatGateway.sendMessage(user.getId(), "Your " + user.getTier().name().toLowerCase()
                        + " subscription ends on " + DATE.format(user.getSubscriptionExpiry())
                        + " (UTC). Renew to keep your links working.");
                userRegistry.markReminderSent(user.getId());
                sent++;
            } catch (RuntimeException e) {
                // Not marked, so the next run tries again
                log.warn("Could not deliver subscription reminder to user {}: {}", user.getId(), e.getMessage());
            }
        }
        if (!due.isEmpty()) {
            log.info("Subscription reminders: {} of {} delivered", sent, due.size());
        }
        return sent;
    }
}
