package com.linlay.skillplatform.backend;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

public class StateFileBackend implements FileBackend {

    public static final String FILES_KEY = "files";

    private final Map<String, Object> state;

    public StateFileBackend(Map<String, Object> state) {
        this.state = state;
    }

    @Override
    public List<FileInfo> ls(String path) {
        String dir = FilePaths.asDirectory(path);
        TreeSet<String> subdirs = new TreeSet<>();
        List<FileInfo> items = new ArrayList<>();
        for (Map.Entry<String, String> entry : files().entrySet()) {
            String filePath = entry.getKey();
            if (!filePath.startsWith(dir)) {
                continue;
            }
            String rest = filePath.substring(dir.length());
            int slash = rest.indexOf('/');
            if (slash >= 0) {
                subdirs.add(dir + rest.substring(0, slash));
                continue;
            }
            items.add(FileInfo.file(filePath, entry.getValue().getBytes(StandardCharsets.UTF_8).length));
        }
        List<FileInfo> result = new ArrayList<>();
        subdirs.forEach(subdir -> result.add(FileInfo.directory(subdir)));
        result.addAll(items);
        return result;
    }

    @Override
    public String read(String path) {
        String content = files().get(FilePaths.normalize(path));
        if (content == null) {
            throw FileBackendException.notFound(path);
        }
        return content;
    }

    @Override
    public void write(String path, String content) {
        String normalized = FilePaths.normalize(path);
        if (normalized.endsWith("/")) {
            throw new FileBackendException(FileBackendException.INVALID_PATH, "Cannot write to a directory: " + path);
        }
        files().put(normalized, content == null ? "" : content);
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> files() {
        Object existing = state.get(FILES_KEY);
        if (existing instanceof Map<?, ?> map) {
            return (Map<String, String>) map;
        }
        Map<String, String> created = new TreeMap<>();
        state.put(FILES_KEY, created);
        return created;
    }
}
