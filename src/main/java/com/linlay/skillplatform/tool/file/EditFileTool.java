package com.linlay.skillplatform.tool.file;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.skillplatform.backend.FileBackend;

import java.util.List;
import java.util.Map;

public class EditFileTool extends AbstractFileTool {

    public EditFileTool(FileBackend backend) {
        super(backend);
    }

    @Override
    public String name() {
        return "edit_file";
    }

    @Override
    public String description() {
        return "Replace an exact string in a file. old_string must be unique unless replace_all is true.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "file_path", Map.of("type", "string"),
                        "old_string", Map.of("type", "string"),
                        "new_string", Map.of("type", "string"),
                        "replace_all", Map.of("type", "boolean")
                ),
                "required", List.of("file_path", "old_string", "new_string"),
                "additionalProperties", false
        );
    }

    @Override
    protected void execute(Map<String, Object> args, ObjectNode result) {
        String path = requireText(args, "file_path", "path");
        String oldString = readRaw(args, "old_string");
        String newString = readRaw(args, "new_string");
        int replacements = backend.edit(path, oldString, newString, readBoolean(args, "replace_all"));
        result.put("path", path);
        result.put("replacements", replacements);
    }
}
