package com.linlay.skillplatform.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * A tool offered to the model. Names are matched case-insensitively, so per turn at most one tool
 * answers to a given lower-cased name.
 */
public interface BaseTool {

    String name();

    default String description() {
        return "";
    }

    default Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(),
                "additionalProperties", true
        );
    }

    /**
     * Runs the tool. Expected failures come back as a result with {@code ok:false} and a {@code code}.
     */
    JsonNode invoke(Map<String, Object> args);
}
