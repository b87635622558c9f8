package com.filelink.api.service;

import lombok.Builder;
import lombok.Value;

/**
 * Who registers what. {@code fileName} may be null for URL registrations; the name is then
 * taken from the URL path.
 */
@Value
@Builder
public class RegistrationRequest {

    long ownerId;

    String username;

    String displayName;

    String fileName;

    String contentType;

    // -1 when unknown
    @Builder.Default
    long declaredSize = -1;

    // null means the DEFAULT_EXPIRY_DAYS setting
    Integer expiryDays;
}
