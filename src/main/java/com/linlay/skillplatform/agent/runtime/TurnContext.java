package com.linlay.skillplatform.agent.runtime;

import com.linlay.skillplatform.skill.SkillSessionSnapshot;
import com.linlay.skillplatform.skill.SkillSlugs;
import com.linlay.skillplatform.tool.BaseTool;
import com.linlay.skillplatform.tool.IntegrationName;
import org.springframework.ai.chat.messages.Message;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one agent turn, handed to the skill hooks by the turn framework.
 * Hooks of a single turn run sequentially, so nothing here is synchronized.
 */
public class TurnContext {

    private final String chatId;
    private final String runId;
    private final List<String> selectedSkills;
    private final Map<String, Object> state = new LinkedHashMap<>();
    private final List<Message> messages = new ArrayList<>();
    private final List<BaseTool> baseTools = new ArrayList<>();
    private final Set<String> activatedSkills = new LinkedHashSet<>();
    private final Map<IntegrationName, List<BaseTool>> integrationTools = new LinkedHashMap<>();

    private String systemPrompt;
    private SkillSessionSnapshot snapshot;
    private boolean skillsPromptInjected;
    private SkillDependencyBundle dependencyBundle = SkillDependencyBundle.EMPTY;

    public TurnContext(String chatId, String runId, List<String> selectedSkills, String systemPrompt) {
        this.chatId = chatId;
        this.runId = runId;
        this.selectedSkills = selectedSkills == null ? List.of() : List.copyOf(selectedSkills);
        this.systemPrompt = systemPrompt == null ? "" : systemPrompt;
    }

    public String chatId() {
        return chatId;
    }

    public String runId() {
        return runId;
    }

    public List<String> selectedSkills() {
        return selectedSkills;
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    public void appendSystemPrompt(String section) {
        if (!StringUtils.hasText(section)) {
            return;
        }
        this.systemPrompt = StringUtils.hasText(systemPrompt) ? systemPrompt + "\n\n" + section : section;
    }

    public Map<String, Object> state() {
        return state;
    }

    public List<Message> messages() {
        return messages;
    }

    public List<BaseTool> baseTools() {
        return baseTools;
    }

    public SkillSessionSnapshot snapshot() {
        return snapshot;
    }

    public void snapshot(SkillSessionSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    public List<String> visibleSkills() {
        if (snapshot != null) {
            return snapshot.visibleSkills();
        }
        return SkillSlugs.normalizeSelected(selectedSkills);
    }

    public boolean skillsPromptInjected() {
        return skillsPromptInjected;
    }

    public void markSkillsPromptInjected() {
        this.skillsPromptInjected = true;
    }

    public Set<String> activatedSkills() {
        return activatedSkills;
    }

    public SkillDependencyBundle dependencyBundle() {
        return dependencyBundle;
    }

    public void dependencyBundle(SkillDependencyBundle dependencyBundle) {
        this.dependencyBundle = dependencyBundle == null ? SkillDependencyBundle.EMPTY : dependencyBundle;
    }

    public Map<IntegrationName, List<BaseTool>> integrationTools() {
        return integrationTools;
    }
}
