package com.filelink.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.filelink.api.dto.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Bearer token check in front of {@code /api/admin/**}. With no token configured the
 * admin API is closed.
 */
@Slf4j
@Component
public class AdminTokenInterceptor implements HandlerInterceptor {

    private static final String BEARER = "Bearer ";

    private final FileLinkProperties properties;
    private final ObjectMapper objectMapper;

    public AdminTokenInterceptor(FileLinkProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        String expected = properties.getAdmin().getApiToken();
        if (expected == null || expected.isBlank()) {
            log.warn("Admin API called but filelink.admin.api-token is not set");
            return reject(response);
        }

        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER)) {
            log.warn("Admin API call without bearer token from {}", request.getRemoteAddr());
            return reject(response);
        }

        String token = authHeader.substring(BEARER.length()).trim();
        if (!MessageDigest.isEqual(token.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Admin API call with invalid token from {}", request.getRemoteAddr());
            return reject(response);
        }
        return true;
    }

    private boolean reject(HttpServletResponse response) throws Exception {
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), ApiResponse.builder()
                .statusCode(HttpStatus.UNAUTHORIZED.value())
                .status("UNAUTHORIZED")
                .message("Missing or invalid admin token")
                .build());
        return false;
    }
}
