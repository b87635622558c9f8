package com.filelink.api.service;

import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import com.filelink.api.support.IntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserRegistryTest extends IntegrationTest {

    @Autowired
    private UserRegistry userRegistry;

    @Test
    void dailyDownloadLimitHoldsUnderConcurrentDownloads() throws Exception {
        long userId = newUserId();
        userRegistry.getOrCreate(userId, "user" + userId, null);

        int threads = 12;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger counted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    if (userRegistry.tryRecordDownload(userId, 5)) {
                        counted.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(20, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(counted.get()).isEqualTo(5);
        assertThat(userRegistry.get(userId).getDownloadsToday()).isEqualTo(5);
    }

    @Test
    void counterStartsOverTheNextDay() {
        long userId = newUserId();
        userRegistry.getOrCreate(userId, "user" + userId, null);
        assertThat(userRegistry.tryRecordDownload(userId, 1)).isTrue();
        assertThat(userRegistry.tryRecordDownload(userId, 1)).isFalse();

        clock.advance(Duration.ofDays(1));

        assertThat(userRegistry.tryRecordDownload(userId, 1)).isTrue();
    }

    @Test
    void blockStateFollowsItsEnd() {
        long userId = newUserId();
        userRegistry.getOrCreate(userId, "user" + userId, null);
        LocalDateTime until = LocalDateTime.now(clock).plusMinutes(30);

        assertThat(userRegistry.block(userId, "flood", until)).isTrue();
        assertThat(userRegistry.block(userId, "flood", until)).isFalse();
        assertThatThrownBy(() -> userRegistry.ensureNotBlocked(userId))
                .isInstanceOf(FileLinkException.class)
                .extracting("reason").isEqualTo(DenialReason.USER_BLOCKED);

        clock.advance(Duration.ofMinutes(30));
        userRegistry.ensureNotBlocked(userId);
        assertThat(userRegistry.isBlocked(userRegistry.get(userId))).isFalse();

        assertThat(userRegistry.unblock(userId)).isTrue();
        assertThat(userRegistry.unblock(userId)).isFalse();
        userRegistry.ensureNotBlocked(newUserId());
    }
}
