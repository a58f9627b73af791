package com.linlay.skillplatform.skill;

import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

public final class SkillSlugs {

    public static final int MAX_LENGTH = 128;

    private static final Pattern SLUG_PATTERN = Pattern.compile("^[a-z0-9]+(-[a-z0-9]+)*$");

    private SkillSlugs() {
    }

    public static boolean isValid(String slug) {
        return slug != null
                && slug.length() <= MAX_LENGTH
                && SLUG_PATTERN.matcher(slug).matches();
    }

    public static String requireValidName(String raw) {
        String name = raw == null ? "" : raw.trim();
        if (!StringUtils.hasText(name)) {
            throw new SkillValidationException("SKILL.md frontmatter is missing name");
        }
        if (name.length() > MAX_LENGTH) {
            throw new SkillValidationException("skill name must not exceed " + MAX_LENGTH + " characters");
        }
        if (!SLUG_PATTERN.matcher(name).matches()) {
            throw new SkillValidationException(
                    "skill name must use lowercase letters, digits and single hyphens: " + name);
        }
        return name;
    }

    public static List<String> normalizeSelected(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String slug : raw) {
            if (slug == null) {
                continue;
            }
            String trimmed = slug.trim();
            if (isValid(trimmed)) {
                seen.add(trimmed);
            }
        }
        return List.copyOf(new ArrayList<>(seen));
    }
}
