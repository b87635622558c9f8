package com.filelink.api.dto;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class BlockRequest {

    private String reason;

    // Missing means until unblocked
    @Positive
    private Integer durationHours;
}
