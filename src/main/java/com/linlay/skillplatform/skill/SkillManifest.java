package com.linlay.skillplatform.skill;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SkillManifest(
        String name,
        String description,
        SkillDependencies dependencies,
        Map<String, Object> frontmatter,
        String body
) {

    public static final String FILE_NAME = "SKILL.md";

    public SkillManifest {
        dependencies = dependencies == null ? SkillDependencies.NONE : dependencies;
        frontmatter = frontmatter == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(frontmatter));
        body = body == null ? "" : body;
    }
}
