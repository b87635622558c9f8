package com.filelink.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class SettingUpdateRequest {

    @NotNull
    private String value;
}
