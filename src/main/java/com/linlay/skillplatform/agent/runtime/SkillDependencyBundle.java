package com.linlay.skillplatform.agent.runtime;

import com.linlay.skillplatform.skill.SkillDependencies;
import com.linlay.skillplatform.skill.SkillSessionSnapshot;
import com.linlay.skillplatform.tool.BaseTool;
import com.linlay.skillplatform.tool.IntegrationName;
import com.linlay.skillplatform.tool.ToolName;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Union of the dependencies declared by the activated skills. A dependency declared again by a
 * later activation moves to the end, so applying the bundle lets the last-activated skill win.
 */
public record SkillDependencyBundle(
        List<String> activatedSkills,
        List<ToolName> tools,
        List<IntegrationName> integrations,
        List<String> skills
) {

    public static final SkillDependencyBundle EMPTY = new SkillDependencyBundle(List.of(), List.of(), List.of(), List.of());

    public SkillDependencyBundle {
        activatedSkills = activatedSkills == null ? List.of() : List.copyOf(activatedSkills);
        tools = tools == null ? List.of() : List.copyOf(tools);
        integrations = integrations == null ? List.of() : List.copyOf(integrations);
        skills = skills == null ? List.of() : List.copyOf(skills);
    }

    public static SkillDependencyBundle of(Collection<String> activatedSkills, SkillSessionSnapshot snapshot) {
        if (activatedSkills == null || activatedSkills.isEmpty() || snapshot == null) {
            return EMPTY;
        }
        Set<ToolName> tools = new LinkedHashSet<>();
        Set<IntegrationName> integrations = new LinkedHashSet<>();
        Set<String> skills = new LinkedHashSet<>();
        for (String slug : activatedSkills) {
            SkillDependencies dependencies = snapshot.dependenciesOf(slug);
            moveToEnd(tools, dependencies.tools());
            moveToEnd(integrations, dependencies.integrations());
            moveToEnd(skills, dependencies.skills());
        }
        return new SkillDependencyBundle(
                List.copyOf(activatedSkills),
                List.copyOf(tools),
                List.copyOf(integrations),
                List.copyOf(skills)
        );
    }

    public boolean isEmpty() {
        return tools.isEmpty() && integrations.isEmpty() && skills.isEmpty();
    }

    /**
     * Puts the declared tools, then the tools of every integration, into {@code target} keyed by
     * lower-cased name. Later entries replace earlier ones.
     *
     * @return declared tools that {@code toolResolver} could not find
     */
    public List<ToolName> applyTo(
            Map<String, BaseTool> target,
            Function<ToolName, Optional<BaseTool>> toolResolver,
            Function<IntegrationName, List<BaseTool>> integrationLoader
    ) {
        List<ToolName> missing = new ArrayList<>();
        for (ToolName toolName : tools) {
            Optional<BaseTool> tool = toolResolver.apply(toolName);
            if (tool.isPresent()) {
                target.put(toolName.value(), tool.get());
            } else {
                missing.add(toolName);
            }
        }
        for (IntegrationName integration : integrations) {
            for (BaseTool tool : integrationLoader.apply(integration)) {
                if (tool != null && tool.name() != null) {
                    target.put(tool.name().trim().toLowerCase(Locale.ROOT), tool);
                }
            }
        }
        return missing;
    }

    private static <T> void moveToEnd(Set<T> ordered, Collection<T> values) {
        for (T value : values) {
            ordered.remove(value);
            ordered.add(value);
        }
    }
}
