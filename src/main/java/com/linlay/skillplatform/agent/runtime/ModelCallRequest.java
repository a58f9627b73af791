package com.linlay.skillplatform.agent.runtime;

import com.linlay.skillplatform.tool.BaseTool;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record ModelCallRequest(
        String systemPrompt,
        List<Message> messages,
        Map<String, BaseTool> tools
) {

    public ModelCallRequest {
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tools));
    }

    public static ModelCallRequest from(TurnContext context) {
        return new ModelCallRequest(context.systemPrompt(), context.messages(), byName(context.baseTools()));
    }

    public static Map<String, BaseTool> byName(List<BaseTool> tools) {
        Map<String, BaseTool> byName = new LinkedHashMap<>();
        for (BaseTool tool : tools) {
            if (tool != null && StringUtils.hasText(tool.name())) {
                byName.putIfAbsent(tool.name().trim().toLowerCase(Locale.ROOT), tool);
            }
        }
        return byName;
    }

    public ModelCallRequest withSystemPrompt(String prompt) {
        return new ModelCallRequest(prompt, messages, tools);
    }

    public ModelCallRequest withTools(Map<String, BaseTool> newTools) {
        return new ModelCallRequest(systemPrompt, messages, newTools);
    }

    public List<Message> toSpringMessages() {
        List<Message> all = new ArrayList<>();
        if (StringUtils.hasText(systemPrompt)) {
            all.add(new SystemMessage(systemPrompt));
        }
        all.addAll(messages);
        return all;
    }
}
