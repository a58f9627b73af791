package com.linlay.skillplatform.skill;

import com.linlay.skillplatform.skill.SkillMetadataCache.SkillPromptMetadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SkillSessionSnapshot(
        List<String> selectedSkills,
        List<String> visibleSkills,
        Map<String, SkillPromptMetadata> promptMetadata,
        Map<String, SkillDependencies> dependencyMap
) {

    public static final SkillSessionSnapshot EMPTY = new SkillSessionSnapshot(List.of(), List.of(), Map.of(), Map.of());

    public SkillSessionSnapshot {
        selectedSkills = selectedSkills == null ? List.of() : List.copyOf(selectedSkills);
        visibleSkills = visibleSkills == null ? List.of() : List.copyOf(visibleSkills);
        promptMetadata = promptMetadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(promptMetadata));
        dependencyMap = dependencyMap == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(dependencyMap));
    }

    public static SkillSessionSnapshot degraded(List<String> selectedSkills) {
        List<String> selected = SkillSlugs.normalizeSelected(selectedSkills);
        return new SkillSessionSnapshot(selected, selected, Map.of(), Map.of());
    }

    public SkillDependencies dependenciesOf(String slug) {
        SkillDependencies dependencies = dependencyMap.get(slug);
        return dependencies == null ? SkillDependencies.NONE : dependencies;
    }
}
