package com.linlay.skillplatform.backend;

import org.springframework.util.StringUtils;

public final class FilePaths {

    private FilePaths() {
    }

    public static String normalize(String raw) {
        if (!StringUtils.hasText(raw)) {
            return "/";
        }
        String path = raw.trim().replace('\\', '/').replaceAll("/{2,}", "/");
        return path.startsWith("/") ? path : "/" + path;
    }

    static String asDirectory(String path) {
        String normalized = normalize(path);
        return normalized.endsWith("/") ? normalized : normalized + "/";
    }
}
