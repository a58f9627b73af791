package com.linlay.skillplatform.backend;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileInfo(String path, boolean directory, Long size) {

    public static FileInfo file(String path, long size) {
        return new FileInfo(path, false, size);
    }

    public static FileInfo directory(String path) {
        return new FileInfo(path.endsWith("/") ? path : path + "/", true, null);
    }

    FileInfo withPath(String newPath) {
        return new FileInfo(newPath, directory, size);
    }
}
