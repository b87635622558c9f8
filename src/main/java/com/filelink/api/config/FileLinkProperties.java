package com.filelink.api.config;

import com.filelink.api.model.ActionClass;
import com.filelink.api.model.SubscriptionTier;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static configuration bound from {@code filelink.*}.
 *
 * Values that an administrator may change at runtime (download domain, trial length,
 * extension lists, ...) are only defaults here; {@code SettingsService} overlays them
 * with whatever the settings store currently holds.
 */
@Data
@ConfigurationProperties(prefix = "filelink")
public class FileLinkProperties {

    private Storage storage = new Storage();

    private Fetch fetch = new Fetch();

    private Sweeper sweeper = new Sweeper();

    private Reminder reminder = new Reminder();

    private Telegram telegram = new Telegram();

    private Admin admin = new Admin();

    private Broadcast broadcast = new Broadcast();

    /**
     * Host used in generated download links, e.g. {@code files.example.com}.
     */
    private String downloadDomain = "localhost:8080";

    /**
     * Scheme used in generated download links.
     */
    private String downloadScheme = "https";

    private int trialDays = 7;

    /**
     * Expiry applied to a new file when the request does not name one.
     */
    private int defaultExpiryDays = 7;

    /**
     * Longest expiry a user may request for a single file.
     */
    private int maxExpiryDays = 30;

    /**
     * Lower-case extensions including the dot. The blocklist wins over the allowlist.
     */
    private Set<String> blockedExtensions = new LinkedHashSet<>(
            List.of(".exe", ".bat", ".cmd", ".sh", ".msi", ".dll", ".scr", ".ps1"));

    /**
     * Empty means every extension not blocked is allowed.
     */
    private Set<String> allowedExtensions = new LinkedHashSet<>();

    private Map<SubscriptionTier, TierQuota> tiers = defaultTiers();

    private Map<ActionClass, RateLimit> rateLimits = defaultRateLimits();

    @Data
    public static class Storage {

        /**
         * Directory holding uploaded bytes. Each file is stored under a random key.
         */
        private String location = "./filelink_uploads";

        /**
         * Hard cap for a single file, applied before any tier quota.
         */
        private long maxFileSize = 2L * 1024 * 1024 * 1024;

        /**
         * Files on disk without a record are removed once older than this.
         */
        private Duration orphanGracePeriod = Duration.ofHours(1);
    }

    @Data
    public static class Fetch {

        private Duration connectTimeout = Duration.ofSeconds(10);

        private Duration readTimeout = Duration.ofSeconds(30);

        /**
         * Wall-clock budget for a whole upload or URL transfer.
         */
        private Duration maxTransferTime = Duration.ofMinutes(30);

        private Set<String> blockedHosts = new LinkedHashSet<>(List.of("localhost", "127.0.0.1", "0.0.0.0"));

        private List<String> illegalPatterns = List.of("magnet:", ".torrent");

        // Background URL downloads running at once
        private int workers = 3;

        private int queueCapacity = 100;

        /**
         * How long a finished background download can still be looked up.
         */
        private Duration taskRetention = Duration.ofHours(24);
    }

    @Data
    public static class Sweeper {

        private long intervalMs = 60_000;

        private long initialDelayMs = 30_000;

        private long orphanIntervalMs = 3_600_000;

        /**
         * Candidates fetched per query while sweeping.
         */
        private int batchSize = 100;
    }

    @Data
    public static class Reminder {

        private String cron = "0 0 9 * * *";

        private int reminderDays = 3;
    }

    @Data
    public static class Telegram {

        private String apiBaseUrl = "https://api.telegram.org";

        private String botToken = "";

        private String requiredChannel = "";
    }

    @Data
    public static class Admin {

        /**
         * Bearer token expected on every {@code /api/admin/**} call.
         */
        private String apiToken = "";

        private Set<Long> ids = new LinkedHashSet<>();
    }

    @Data
    public static class Broadcast {

        private int poolSize = 4;

        private Duration perRecipientTimeout = Duration.ofSeconds(10);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierQuota {

        private long maxFileSize;

        private int maxFiles;

        private long maxStorageBytes;

        private int maxDownloadsPerDay;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RateLimit {

        private int limit;

        private Duration window;
    }

    private static Map<SubscriptionTier, TierQuota> defaultTiers() {
        long mb = 1024L * 1024;
        Map<SubscriptionTier, TierQuota> tiers = new EnumMap<>(SubscriptionTier.class);
        tiers.put(SubscriptionTier.TRIAL, new TierQuota(50 * mb, 10, 100 * mb, 100));
        tiers.put(SubscriptionTier.BASIC, new TierQuota(500 * mb, 100, 5_000 * mb, 1_000));
        tiers.put(SubscriptionTier.PREMIUM, new TierQuota(2_000 * mb, 1_000, 50_000 * mb, 10_000));
        return tiers;
    }

    private static Map<ActionClass, RateLimit> defaultRateLimits() {
        Map<ActionClass, RateLimit> limits = new EnumMap<>(ActionClass.class);
        limits.put(ActionClass.MESSAGE, new RateLimit(30, Duration.ofMinutes(1)));
        limits.put(ActionClass.UPLOAD, new RateLimit(10, Duration.ofMinutes(1)));
        limits.put(ActionClass.FILE_DOWNLOAD, new RateLimit(60, Duration.ofMinutes(1)));
        limits.put(ActionClass.BROADCAST, new RateLimit(5, Duration.ofMinutes(1)));
        return limits;
    }
}
