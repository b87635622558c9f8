package com.filelink.api.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Download tokens are capabilities: 256 random bits, URL-safe, unrelated to the file.
 */
@Component
public class TokenGenerator {

    private static final int TOKEN_BYTES = 32;
    private static final int VISIBLE_CHARS = 6;

    private final SecureRandom random = new SecureRandom();

    public String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    // Safe form for logs
    public static String mask(String token) {
        if (token == null || token.length() <= VISIBLE_CHARS) {
            return "***";
        }
        return token.substring(0, VISIBLE_CHARS) + "***";
    }
}
