package com.linlay.skillplatform.tool;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<ToolName, BaseTool> toolsByName;

    public ToolRegistry(List<BaseTool> tools) {
        this.toolsByName = buildToolsByName(tools);
    }

    @Autowired
    public ToolRegistry(ObjectProvider<BaseTool> toolsProvider) {
        this(toolsProvider.orderedStream().toList());
    }

    public JsonNode invoke(String toolName, Map<String, Object> args) {
        BaseTool tool = ToolName.isValid(toolName) ? toolsByName.get(ToolName.of(toolName)) : null;
        if (Objects.isNull(tool)) {
            throw new IllegalArgumentException("Unknown tool: " + toolName);
        }
        return tool.invoke(args);
    }

    public Optional<BaseTool> find(ToolName name) {
        return Optional.ofNullable(toolsByName.get(name));
    }

    public boolean contains(ToolName name) {
        return toolsByName.containsKey(name);
    }

    public List<BaseTool> list() {
        return List.copyOf(toolsByName.values());
    }

    private Map<ToolName, BaseTool> buildToolsByName(List<BaseTool> tools) {
        Map<ToolName, BaseTool> byName = new LinkedHashMap<>();
        for (BaseTool tool : tools == null ? List.<BaseTool>of() : tools) {
            if (tool == null || !ToolName.isValid(tool.name())) {
                log.warn("Skip tool with invalid name: {}", tool == null ? null : tool.name());
                continue;
            }
            ToolName name = ToolName.of(tool.name());
            if (byName.putIfAbsent(name, tool) != null) {
                log.warn("Duplicate tool name '{}', keeping the first registration", name);
            }
        }
        return byName;
    }
}
