package com.linlay.skillplatform.tool.file;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.skillplatform.backend.FileBackend;

import java.util.List;
import java.util.Map;

public class WriteFileTool extends AbstractFileTool {

    public WriteFileTool(FileBackend backend) {
        super(backend);
    }

    @Override
    public String name() {
        return "write_file";
    }

    @Override
    public String description() {
        return "Create or overwrite a text file. Paths under /skills/ are read-only.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "file_path", Map.of("type", "string", "description", "Absolute file path"),
                        "content", Map.of("type", "string", "description", "Full file content")
                ),
                "required", List.of("file_path", "content"),
                "additionalProperties", false
        );
    }

    @Override
    protected void execute(Map<String, Object> args, ObjectNode result) {
        String path = requireText(args, "file_path", "path");
        String content = readRaw(args, "content");
        backend.write(path, content == null ? "" : content);
        result.put("path", path);
    }
}
