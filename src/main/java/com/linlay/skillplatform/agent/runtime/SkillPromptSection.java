package com.linlay.skillplatform.agent.runtime;

import com.linlay.skillplatform.skill.SkillMetadataCache.SkillPromptMetadata;

import java.util.Collection;

public record SkillPromptSection(
        String heading,
        String intro,
        String directoryLine,
        String availableHeader,
        String usageGuide
) {
    public static final SkillPromptSection DEFAULTS = new SkillPromptSection(
            "## Skills System",
            "You have access to a skills library that provides specialized capabilities and domain knowledge.",
            "**Skills Directory**: `/skills/` (read-only)",
            "**Available Skills:**",
            """
                    **How to Use Skills (Progressive Disclosure):**

                    Skills follow a progressive disclosure pattern: you see the name and description above, \
                    and read the full instructions only when you need them.

                    1. **Recognize when a skill applies**: check whether the user's task matches a skill's description
                    2. **Read the skill's full instructions**: use `read_file` on the path shown in the skill list
                    3. **Follow the skill's instructions**: SKILL.md contains step-by-step workflows and examples
                    4. **Access supporting files**: skills may ship helper scripts, configs or reference docs; \
                    use absolute paths under `/skills/`

                    Tools a skill depends on become available after its SKILL.md has been read."""
    );

    public String render(Collection<SkillPromptMetadata> skills) {
        StringBuilder builder = new StringBuilder();
        builder.append(heading).append("\n\n")
                .append(intro).append("\n\n")
                .append(directoryLine).append("\n\n")
                .append(availableHeader).append("\n\n");
        for (SkillPromptMetadata skill : skills) {
            builder.append("- **").append(skill.name()).append("**: ").append(skill.description()).append('\n')
                    .append("  -> Read `").append(skill.path()).append("` for full instructions\n");
        }
        builder.append('\n').append(usageGuide);
        return builder.toString();
    }
}
