package com.linlay.skillplatform.skill;

import java.util.List;

public record SkillRecord(
        long id,
        String slug,
        String name,
        String description,
        String dirPath,
        List<String> toolDependencies,
        List<String> integrationDependencies,
        List<String> skillDependencies,
        String createdBy,
        String updatedBy,
        long createdAt,
        long updatedAt
) {
    public SkillRecord {
        toolDependencies = toolDependencies == null ? List.of() : List.copyOf(toolDependencies);
        integrationDependencies = integrationDependencies == null ? List.of() : List.copyOf(integrationDependencies);
        skillDependencies = skillDependencies == null ? List.of() : List.copyOf(skillDependencies);
    }

    public SkillDependencies dependencies() {
        return SkillDependencies.fromStrings(toolDependencies, integrationDependencies, skillDependencies);
    }

    public SkillRecord withMetadata(String name, String description, String updatedBy, long updatedAt) {
        return new SkillRecord(
                id, slug, name, description, dirPath,
                toolDependencies, integrationDependencies, skillDependencies,
                createdBy, updatedBy, createdAt, updatedAt
        );
    }

    public SkillRecord withDependencies(SkillDependencies dependencies, String updatedBy, long updatedAt) {
        return new SkillRecord(
                id, slug, name, description, dirPath,
                dependencies.toolNames(), dependencies.integrationNames(), dependencies.skills(),
                createdBy, updatedBy, createdAt, updatedAt
        );
    }
}
