package com.linlay.skillplatform.agent.runtime;

import com.linlay.skillplatform.backend.SkillFileBackendFactory;
import com.linlay.skillplatform.skill.SkillCatalogProperties;
import com.linlay.skillplatform.tool.BaseTool;
import com.linlay.skillplatform.tool.ToolRegistry;
import com.linlay.skillplatform.tool.file.FileToolset;
import org.springframework.ai.chat.messages.Message;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class TurnContextFactory {

    private final ToolRegistry toolRegistry;
    private final SkillFileBackendFactory backendFactory;
    private final SkillCatalogProperties properties;

    public TurnContextFactory(
            ToolRegistry toolRegistry,
            SkillFileBackendFactory backendFactory,
            SkillCatalogProperties properties
    ) {
        this.toolRegistry = toolRegistry;
        this.backendFactory = backendFactory;
        this.properties = properties;
    }

    public TurnContext open(
            String chatId,
            String runId,
            List<String> selectedSkills,
            String systemPrompt,
            List<Message> history
    ) {
        TurnContext context = new TurnContext(chatId, runId, selectedSkills, systemPrompt);
        if (history != null) {
            context.messages().addAll(history);
        }
        List<BaseTool> fileTools = FileToolset.forTurn(backendFactory.create(context), properties.getMaxReadLines());
        Set<String> fileToolNames = fileTools.stream()
                .map(tool -> tool.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        context.baseTools().addAll(fileTools);
        for (BaseTool tool : toolRegistry.list()) {
            if (!fileToolNames.contains(tool.name().toLowerCase(Locale.ROOT))) {
                context.baseTools().add(tool);
            }
        }
        return context;
    }
}
