package com.filelink.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class UrlRegistrationRequest {

    @NotBlank
    private String url;

    // Optional, taken from the URL path when missing
    private String fileName;

    @Min(1)
    private Integer expiryDays;
}
