package com.linlay.skillplatform.tool.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.skillplatform.backend.FileBackend;
import com.linlay.skillplatform.backend.FileBackendException;
import com.linlay.skillplatform.tool.BaseTool;

import java.util.Map;

/**
 * File tool bound to one turn's backend. Backend failures become {@code ok:false} results.
 */
public abstract class AbstractFileTool implements BaseTool {

    protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    protected final FileBackend backend;

    protected AbstractFileTool(FileBackend backend) {
        this.backend = backend;
    }

    @Override
    public final JsonNode invoke(Map<String, Object> args) {
        ObjectNode result = OBJECT_MAPPER.createObjectNode();
        result.put("tool", name());
        Map<String, Object> safeArgs = args == null ? Map.of() : args;
        try {
            execute(safeArgs, result);
            result.put("ok", true);
        } catch (FileBackendException ex) {
            return failure(result, ex.code(), ex.getMessage());
        } catch (IllegalArgumentException ex) {
            return failure(result, "invalid_argument", ex.getMessage());
        }
        return result;
    }

    protected abstract void execute(Map<String, Object> args, ObjectNode result);

    protected String requireText(Map<String, Object> args, String... keys) {
        String value = readText(args, keys);
        if (value == null) {
            throw new IllegalArgumentException("Missing argument: " + keys[0]);
        }
        return value;
    }

    protected String readText(Map<String, Object> args, String... keys) {
        for (String key : keys) {
            Object value = args.get(key);
            if (value != null && !value.toString().isBlank()) {
                return value.toString().trim();
            }
        }
        return null;
    }

    protected String readRaw(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value == null ? null : value.toString();
    }

    protected int readInt(Map<String, Object> args, String key, int defaultValue) {
        Object value = args.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Argument " + key + " must be an integer");
        }
    }

    protected boolean readBoolean(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null && Boolean.parseBoolean(value.toString().trim());
    }

    private JsonNode failure(ObjectNode result, String code, String error) {
        result.put("ok", false);
        result.put("code", code);
        result.put("error", error == null ? "Unknown error" : error);
        return result;
    }
}
