package com.filelink.api.client;

/**
 * Outbound side of the chat transport.
 */
public interface ChatGateway {

    /**
     * Delivers a plain text message. Throws on any delivery failure.
     */
    void sendMessage(long chatId, String text);
}
