package com.linlay.skillplatform.model.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record UpdateFileRequest(
        @NotBlank
        String skillId,
        @NotBlank
        String path,
        @NotNull
        String content
) {
}
