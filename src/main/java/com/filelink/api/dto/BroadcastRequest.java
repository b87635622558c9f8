package com.filelink.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class BroadcastRequest {

    @NotBlank
    private String message;
}
