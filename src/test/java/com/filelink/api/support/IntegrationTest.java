package com.filelink.api.support;

import com.filelink.api.client.ChannelMembershipChecker;
import com.filelink.api.client.ChatGateway;
import com.filelink.api.client.RemoteFileFetcher;
import com.filelink.api.model.AuditAction;
import com.filelink.api.repository.AuditRepository;
import com.filelink.api.service.FileRegistrationService;
import com.filelink.api.service.Registration;
import com.filelink.api.service.RegistrationRequest;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import java.io.ByteArrayInputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base for tests against the full context on an in-memory database. All subclasses share
 * one context, so every test works with its own fresh user ids and starts thirty days
 * after the previous test on the shared clock.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(IntegrationTest.ClockConfig.class)
public abstract class IntegrationTest {

    private static final Instant START = Instant.parse("2030-01-01T10:00:00Z");
    private static final AtomicLong PERIOD = new AtomicLong();
    private static final AtomicLong USER_IDS = new AtomicLong(1_000_000);

    @TestConfiguration
    static class ClockConfig {

        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(START);
        }
    }

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected FileRegistrationService registrationService;

    @Autowired
    protected AuditRepository auditRepository;

    @MockBean
    protected ChatGateway chatGateway;

    @MockBean
    protected ChannelMembershipChecker membershipChecker;

    @MockBean
    protected RemoteFileFetcher remoteFileFetcher;

    @BeforeEach
    void moveClockForward() {
        clock.setInstant(START.plus(Duration.ofDays(30 * PERIOD.incrementAndGet())));
    }

    protected static long newUserId() {
        return USER_IDS.incrementAndGet();
    }

    // Random content, so uploads never share bytes by accident
    protected static byte[] randomBytes(int size) {
        byte[] bytes = new byte[size];
        ThreadLocalRandom.current().nextBytes(bytes);
        return bytes;
    }

    protected Registration upload(long ownerId, String fileName, byte[] content, int expiryDays) {
        RegistrationRequest request = RegistrationRequest.builder()
                .ownerId(ownerId)
                .username("user" + ownerId)
                .displayName("User " + ownerId)
                .fileName(fileName)
                .contentType("application/octet-stream")
                .declaredSize(content.length)
                .expiryDays(expiryDays)
                .build();
        return registrationService.registerUpload(request, new ByteArrayInputStream(content));
    }

    protected long auditCount(String fileId, AuditAction action) {
        return auditRepository.findByFileIdAndAction(fileId, action).size();
    }
}
