package com.linlay.skillplatform.skill;

import org.springframework.util.StringUtils;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and rewrites the {@code ---} delimited YAML frontmatter of a skill manifest.
 */
public final class SkillManifestParser {

    static final String TOOLS_KEY = "tools";
    static final String INTEGRATIONS_KEY = "integrations";
    static final String SKILLS_KEY = "skills";

    private static final Pattern FRONTMATTER_PATTERN =
            Pattern.compile("\\A---[ \\t]*\\n(.*?)\\n---[ \\t]*(?:\\n|\\z)", Pattern.DOTALL);

    private SkillManifestParser() {
    }

    public static SkillManifest parse(String content) {
        Frontmatter frontmatter = readFrontmatter(content);
        Map<String, Object> data = frontmatter.data();

        String name = SkillSlugs.requireValidName(stringValue(data.get("name")));
        String description = stringValue(data.get("description")).trim();
        if (!StringUtils.hasText(description)) {
            throw new SkillValidationException("SKILL.md frontmatter is missing description");
        }

        SkillDependencies dependencies = SkillDependencies.fromStrings(
                stringList(data, TOOLS_KEY),
                stringList(data, INTEGRATIONS_KEY),
                stringList(data, SKILLS_KEY)
        );
        if (dependencies.skills().contains(name)) {
            throw new SkillValidationException("skill must not depend on itself: " + name);
        }
        return new SkillManifest(name, description, dependencies, data, frontmatter.body());
    }

    public static String rewriteName(String content, String newName) {
        Frontmatter frontmatter = readFrontmatter(content);
        Map<String, Object> data = new LinkedHashMap<>(frontmatter.data());
        data.put("name", newName);

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setAllowUnicode(true);
        String dumped = new Yaml(options).dump(data).trim();
        return "---\n" + dumped + "\n---\n" + frontmatter.body();
    }

    private static Frontmatter readFrontmatter(String content) {
        String normalized = content == null ? "" : content.replace("\r\n", "\n");
        Matcher matcher = FRONTMATTER_PATTERN.matcher(normalized);
        if (!matcher.find()) {
            throw new SkillValidationException("SKILL.md is missing a valid frontmatter block (--- ... ---)");
        }

        Object loaded;
        try {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(matcher.group(1));
        } catch (YAMLException ex) {
            throw new SkillValidationException("SKILL.md frontmatter is not valid YAML: " + ex.getMessage(), ex);
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new SkillValidationException("SKILL.md frontmatter must be a mapping");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        map.forEach((key, value) -> data.put(String.valueOf(key), value));
        return new Frontmatter(data, normalized.substring(matcher.end()));
    }

    private static List<String> stringList(Map<String, Object> data, String key) {
        Object raw = data.get(key);
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof String text) {
            return StringUtils.hasText(text) ? List.of(text.trim()) : List.of();
        }
        if (!(raw instanceof Collection<?> values)) {
            throw new SkillValidationException("SKILL.md frontmatter '" + key + "' must be a list of strings");
        }
        List<String> result = new ArrayList<>();
        for (Object value : values) {
            if (!(value instanceof String text)) {
                throw new SkillValidationException("SKILL.md frontmatter '" + key + "' must be a list of strings");
            }
            result.add(text.trim());
        }
        return result;
    }

    private static String stringValue(Object raw) {
        return raw == null ? "" : String.valueOf(raw);
    }

    private record Frontmatter(Map<String, Object> data, String body) {
    }
}
