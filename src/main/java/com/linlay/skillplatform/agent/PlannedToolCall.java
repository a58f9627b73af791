package com.linlay.skillplatform.agent;

import java.util.Map;

public record PlannedToolCall(
        String name,
        Map<String, Object> arguments,
        String callId
) {
    public PlannedToolCall {
        name = name == null ? "" : name.trim();
        arguments = arguments == null ? Map.of() : arguments;
    }
}
