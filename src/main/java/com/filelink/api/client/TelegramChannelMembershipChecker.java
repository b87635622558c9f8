package com.filelink.api.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.filelink.api.config.FileLinkProperties;
import com.filelink.api.settings.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Set;

/**
 * Looks up channel membership with the Bot API {@code getChatMember} method.
 * Lookup failures come back as {@link Membership#UNKNOWN}.
 */
@Slf4j
@Component
public class TelegramChannelMembershipChecker implements ChannelMembershipChecker {

    private static final Set<String> MEMBER_STATES = Set.of("creator", "administrator", "member");

    private final RestTemplate restTemplate;
    private final FileLinkProperties properties;
    private final SettingsService settings;

    public TelegramChannelMembershipChecker(RestTemplate restTemplate, FileLinkProperties properties,
                                            SettingsService settings) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.settings = settings;
    }

    @Override
    public Membership check(long userId, String channel) {
        String url = properties.getTelegram().getApiBaseUrl() + "/bot{token}/getChatMember?chat_id={chat}&user_id={user}";
        try {
            JsonNode response = restTemplate.getForObject(url, JsonNode.class, settings.botToken(), channel, userId);
            if (response == null || !response.path("ok").asBoolean(false)) {
                return Membership.UNKNOWN;
            }
            JsonNode result = response.path("result");
            String status = result.path("status").asText("");
            // Restricted users may or may not still be in the chat
            boolean member = MEMBER_STATES.contains(status)
                    || ("restricted".equals(status) && result.path("is_member").asBoolean(false));
            return member ? Membership.MEMBER : Membership.NOT_MEMBER;
        } catch (RestClientException e) {
            log.warn("Membership lookup for user {} in {} failed: {}", userId, channel, e.getMessage());
            return Membership.UNKNOWN;
        }
    }
}
