package com.linlay.skillplatform.model.api;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record UpdateDependenciesRequest(
        @NotBlank
        String skillId,
        List<String> tools,
        List<String> integrations,
        List<String> skills
) {
}
