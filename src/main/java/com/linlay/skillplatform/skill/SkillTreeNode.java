package com.linlay.skillplatform.skill;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SkillTreeNode(
        String name,
        String path,
        boolean directory,
        List<SkillTreeNode> children
) {
    public static SkillTreeNode file(String name, String path) {
        return new SkillTreeNode(name, path, false, null);
    }

    public static SkillTreeNode directory(String name, String path, List<SkillTreeNode> children) {
        return new SkillTreeNode(name, path, true, List.copyOf(children));
    }
}
