package com.linlay.skillplatform.tool.file;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.skillplatform.backend.FileBackend;
import com.linlay.skillplatform.backend.FileInfo;

import java.util.Map;

public class ListFilesTool extends AbstractFileTool {

    public ListFilesTool(FileBackend backend) {
        super(backend);
    }

    @Override
    public String name() {
        return "ls";
    }

    @Override
    public String description() {
        return "List files and directories under an absolute path. Skills live under /skills/.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "path", Map.of("type", "string", "description", "Absolute directory path, defaults to /")
                ),
                "additionalProperties", false
        );
    }

    @Override
    protected void execute(Map<String, Object> args, ObjectNode result) {
        String path = readText(args, "path");
        String target = path == null ? "/" : path;
        ArrayNode entries = result.putArray("entries");
        for (FileInfo info : backend.ls(target)) {
            entries.add(OBJECT_MAPPER.valueToTree(info));
        }
        result.put("path", target);
    }
}
