package com.filelink.api.client;

import com.filelink.api.config.FileLinkProperties;
import com.filelink.api.settings.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Sends messages through the Telegram Bot API {@code sendMessage} method.
 */
@Slf4j
@Component
public class TelegramChatGateway implements ChatGateway {

    private final RestTemplate restTemplate;
    private final FileLinkProperties properties;
    private final SettingsService settings;

    public TelegramChatGateway(RestTemplate restTemplate, FileLinkProperties properties, SettingsService settings) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.settings = settings;
    }

    @Override
    public void sendMessage(long chatId, String text) {
        String url = properties.getTelegram().getApiBaseUrl() + "/bot{token}/sendMessage";
        Map<String, Object> body = Map.of("chat_id", chatId, "text", text);
        restTemplate.postForObject(url, body, String.class, settings.botToken());
        log.debug("Delivered message to chat {}", chatId);
    }
}
