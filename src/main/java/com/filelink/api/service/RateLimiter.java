package com.filelink.api.service;

import com.filelink.api.config.FileLinkProperties;
import com.filelink.api.exception.RateLimitedException;
import com.filelink.api.model.ActionClass;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * Sliding-window admission control, one window per (user, action class).
 *
 * Each window is only touched inside {@link ConcurrentMap#compute} on the cache's map view,
 * which serializes admissions for the same key. Windows nobody touched for longer than the
 * widest configured window drop out of the cache on their own.
 */
@Slf4j
@Service
public class RateLimiter {

    @Value
    private static class WindowKey {
        long userId;
        ActionClass actionClass;
    }

    private final Cache<WindowKey, Deque<Instant>> windows;
    private final FileLinkProperties properties;
    private final Clock clock;

    public RateLimiter(FileLinkProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(longestWindow(properties))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    /**
     * Records the action when admitted.
     *
     * @throws RateLimitedException with the time until the oldest action leaves the window
     */
    public void admit(long userId, ActionClass actionClass) {
        FileLinkProperties.RateLimit limit = properties.getRateLimits().get(actionClass);
        if (limit == null || limit.getLimit() <= 0) {
            return; // unlimited
        }
        Duration window = limit.getWindow();

        windows.asMap().compute(new WindowKey(userId, actionClass), (key, timestamps) -> {
            Deque<Instant> deque = timestamps != null ? timestamps : new ArrayDeque<>();
            Instant now = clock.instant();
            prune(deque, now.minus(window));

            if (deque.size() >= limit.getLimit()) {
                Duration retryAfter = Duration.between(now, deque.peekFirst().plus(window));
                log.debug("Rate limited user {} on {}, retry after {}", userId, actionClass, retryAfter);
                throw new RateLimitedException(userId, actionClass, retryAfter);
            }
            deque.addLast(now);
            return deque;
        });
    }

    /**
     * Actions currently counted for the user in the given class.
     */
    public int currentCount(long userId, ActionClass actionClass) {
        FileLinkProperties.RateLimit limit = properties.getRateLimits().get(actionClass);
        if (limit == null) {
            return 0;
        }
        Deque<Instant> result = windows.asMap().computeIfPresent(new WindowKey(userId, actionClass), (key, deque) -> {
            prune(deque, clock.instant().minus(limit.getWindow()));
            return deque.isEmpty() ? null : deque;
        });
        return result == null ? 0 : result.size();
    }

    long trackedWindows() {
        windows.cleanUp();
        return windows.estimatedSize();
    }

    private static Duration longestWindow(FileLinkProperties properties) {
        return properties.getRateLimits().values().stream()
                .map(FileLinkProperties.RateLimit::getWindow)
                .filter(w -> w != null && !w.isNegative() && !w.isZero())
                .max(Duration::compareTo)
                .orElse(Duration.ofMinutes(1));
    }

    private static void prune(Deque<Instant> deque, Instant windowStart) {
        while (!deque.isEmpty() && !deque.peekFirst().isAfter(windowStart)) {
            deque.pollFirst();
        }
    }
}
