package com.linlay.skillplatform.tool;

import java.util.regex.Pattern;

public record IntegrationName(String value) {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_][A-Za-z0-9_.\\-]{0,127}$");

    public IntegrationName {
        String normalized = value == null ? "" : value.trim();
        if (!NAME_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid integration name: " + value);
        }
        value = normalized;
    }

    public static IntegrationName of(String raw) {
        return new IntegrationName(raw);
    }

    @Override
    public String toString() {
        return value;
    }
}
