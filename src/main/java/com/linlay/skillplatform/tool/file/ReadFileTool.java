package com.linlay.skillplatform.tool.file;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.skillplatform.backend.FileBackend;

import java.util.List;
import java.util.Map;

public class ReadFileTool extends AbstractFileTool {

    private final int defaultLimit;

    public ReadFileTool(FileBackend backend, int defaultLimit) {
        super(backend);
        this.defaultLimit = defaultLimit > 0 ? defaultLimit : 2_000;
    }

    @Override
    public String name() {
        return "read_file";
    }

    @Override
    public String description() {
        return "Read a text file. Use offset (0-based line) and limit to page through long files.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "file_path", Map.of("type", "string", "description", "Absolute file path"),
                        "offset", Map.of("type", "integer", "description", "First line to read, 0-based"),
                        "limit", Map.of("type", "integer", "description", "Maximum number of lines")
                ),
                "required", List.of("file_path"),
                "additionalProperties", false
        );
    }

    @Override
    protected void execute(Map<String, Object> args, ObjectNode result) {
        String path = requireText(args, "file_path", "path");
        int offset = readInt(args, "offset", 0);
        int limit = readInt(args, "limit", defaultLimit);
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }

        String content = backend.read(path);
        String[] lines = content.isEmpty() ? new String[0] : content.split("\r?\n", -1);
        int totalLines = lines.length > 0 && lines[lines.length - 1].isEmpty() ? lines.length - 1 : lines.length;
        if (offset > 0 && offset >= totalLines) {
            throw new IllegalArgumentException("offset " + offset + " exceeds file length " + totalLines);
        }
        int end = (int) Math.min((long) offset + limit, totalLines);
        StringBuilder numbered = new StringBuilder();
        for (int i = offset; i < end; i++) {
            numbered.append(String.format("%6d\t%s", i + 1, lines[i]));
            if (i + 1 < end) {
                numbered.append('\n');
            }
        }
        result.put("path", path);
        result.put("content", numbered.toString());
        result.put("totalLines", totalLines);
        result.put("truncated", end < totalLines);
    }
}
