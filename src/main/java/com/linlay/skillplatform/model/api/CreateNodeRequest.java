package com.linlay.skillplatform.model.api;

import jakarta.validation.constraints.NotBlank;

public record CreateNodeRequest(
        @NotBlank
        String skillId,
        @NotBlank
        String path,
        boolean directory,
        String content
) {
}
