package com.filelink.api.dto;

import com.filelink.api.model.SubscriptionTier;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class SubscriptionGrantRequest {

    @NotNull
    private SubscriptionTier tier;

    // Null grants a lifetime subscription
    private LocalDateTime expiry;
}
