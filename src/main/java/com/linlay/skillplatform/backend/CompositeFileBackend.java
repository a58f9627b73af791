package com.linlay.skillplatform.backend;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes calls by path prefix. A route prefix such as {@code /skills/} is stripped before the call
 * reaches its backend and restored on returned paths; unmatched paths go to the default backend.
 */
public class CompositeFileBackend implements FileBackend {

    private final FileBackend defaultBackend;
    private final Map<String, FileBackend> routes;

    public CompositeFileBackend(FileBackend defaultBackend, Map<String, FileBackend> routes) {
        this.defaultBackend = defaultBackend;
        Map<String, FileBackend> sorted = new LinkedHashMap<>();
        routes.entrySet().stream()
                .sorted(Comparator.comparing((Map.Entry<String, FileBackend> entry) -> entry.getKey().length()).reversed())
                .forEach(entry -> sorted.put(FilePaths.asDirectory(entry.getKey()), entry.getValue()));
        this.routes = sorted;
    }

    @Override
    public List<FileInfo> ls(String path) {
        String normalized = FilePaths.normalize(path);
        Route route = route(normalized);
        if (route != null) {
            return route.backend().ls(route.innerPath()).stream()
                    .map(info -> info.withPath(route.outerPath(info.path())))
                    .toList();
        }
        List<FileInfo> items = new ArrayList<>(defaultBackend.ls(normalized));
        if ("/".equals(normalized)) {
            routes.keySet().forEach(prefix -> items.add(FileInfo.directory(prefix)));
        }
        return items;
    }

    @Override
    public String read(String path) {
        String normalized = FilePaths.normalize(path);
        Route route = route(normalized);
        return route == null ? defaultBackend.read(normalized) : route.backend().read(route.innerPath());
    }

    @Override
    public void write(String path, String content) {
        String normalized = FilePaths.normalize(path);
        Route route = route(normalized);
        if (route == null) {
            defaultBackend.write(normalized, content);
            return;
        }
        route.backend().write(route.innerPath(), content);
    }

    @Override
    public int edit(String path, String oldString, String newString, boolean replaceAll) {
        String normalized = FilePaths.normalize(path);
        Route route = route(normalized);
        return route == null
                ? defaultBackend.edit(normalized, oldString, newString, replaceAll)
                : route.backend().edit(route.innerPath(), oldString, newString, replaceAll);
    }

    private Route route(String normalized) {
        for (Map.Entry<String, FileBackend> entry : routes.entrySet()) {
            String prefix = entry.getKey();
            if (normalized.startsWith(prefix) || normalized.equals(prefix.substring(0, prefix.length() - 1))) {
                String inner = normalized.length() <= prefix.length() ? "/" : "/" + normalized.substring(prefix.length());
                return new Route(prefix, entry.getValue(), inner);
            }
        }
        return null;
    }

    private record Route(String prefix, FileBackend backend, String innerPath) {

        String outerPath(String inner) {
            String base = prefix.substring(0, prefix.length() - 1);
            return inner.startsWith("/") ? base + inner : base + "/" + inner;
        }
    }
}
