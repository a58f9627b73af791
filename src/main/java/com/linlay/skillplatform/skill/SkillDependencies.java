package com.linlay.skillplatform.skill;

import com.linlay.skillplatform.tool.IntegrationName;
import com.linlay.skillplatform.tool.ToolName;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

public record SkillDependencies(
        List<ToolName> tools,
        List<IntegrationName> integrations,
        List<String> skills
) {

    public static final SkillDependencies NONE = new SkillDependencies(List.of(), List.of(), List.of());

    public SkillDependencies {
        tools = distinct(tools);
        integrations = distinct(integrations);
        skills = distinct(skills);
    }

    public static SkillDependencies fromStrings(
            Collection<String> tools,
            Collection<String> integrations,
            Collection<String> skills
    ) {
        List<ToolName> toolNames = new ArrayList<>();
        for (String raw : nullSafe(tools)) {
            try {
                toolNames.add(ToolName.of(raw));
            } catch (IllegalArgumentException ex) {
                throw new SkillValidationException(ex.getMessage());
            }
        }
        List<IntegrationName> integrationNames = new ArrayList<>();
        for (String raw : nullSafe(integrations)) {
            try {
                integrationNames.add(IntegrationName.of(raw));
            } catch (IllegalArgumentException ex) {
                throw new SkillValidationException(ex.getMessage());
            }
        }
        List<String> skillSlugs = new ArrayList<>();
        for (String raw : nullSafe(skills)) {
            String slug = raw == null ? "" : raw.trim();
            if (!SkillSlugs.isValid(slug)) {
                throw new SkillValidationException("Invalid skill dependency: " + raw);
            }
            skillSlugs.add(slug);
        }
        return new SkillDependencies(toolNames, integrationNames, skillSlugs);
    }

    public List<String> toolNames() {
        return tools.stream().map(ToolName::value).toList();
    }

    public List<String> integrationNames() {
        return integrations.stream().map(IntegrationName::value).toList();
    }

    public boolean isEmpty() {
        return tools.isEmpty() && integrations.isEmpty() && skills.isEmpty();
    }

    private static <T> List<T> distinct(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return List.copyOf(new LinkedHashSet<>(values.stream().filter(Objects::nonNull).toList()));
    }

    private static Collection<String> nullSafe(Collection<String> values) {
        return values == null ? List.of() : values;
    }
}
