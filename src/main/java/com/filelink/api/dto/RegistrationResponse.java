package com.filelink.api.dto;

import com.filelink.api.service.Registration;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class RegistrationResponse {

    String fileId;
    String fileName;
    long size;
    LocalDateTime expiryTime;
    String downloadUrl;

    public static RegistrationResponse from(Registration registration) {
        return RegistrationResponse.builder()
                .fileId(registration.getFile().getId())
                .fileName(registration.getFile().getOriginalFilename())
                .size(registration.getFile().getSize())
                .expiryTime(registration.getFile().getExpiryTime())
                .downloadUrl(registration.getDownloadUrl())
                .build();
    }
}
