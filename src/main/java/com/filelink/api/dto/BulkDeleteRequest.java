package com.filelink.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
public class BulkDeleteRequest {

    @NotEmpty
    @Size(max = 100)
    private List<String> fileIds;
}
