package com.linlay.skillplatform.tool;

import java.util.Locale;
import java.util.regex.Pattern;

public record ToolName(String value) implements Comparable<ToolName> {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9_][a-z0-9_.\\-]{0,127}$");

    public ToolName {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        if (!NAME_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid tool name: " + value);
        }
        value = normalized;
    }

    public static ToolName of(String raw) {
        return new ToolName(raw);
    }

    public static boolean isValid(String raw) {
        return raw != null && NAME_PATTERN.matcher(raw.trim().toLowerCase(Locale.ROOT)).matches();
    }

    @Override
    public int compareTo(ToolName other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
