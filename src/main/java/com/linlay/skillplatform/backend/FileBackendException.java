package com.linlay.skillplatform.backend;

public class FileBackendException extends RuntimeException {

    public static final String NOT_FOUND = "not_found";
    public static final String READ_ONLY = "read_only";
    public static final String INVALID_PATH = "invalid_path";
    public static final String UNSUPPORTED_FILE = "unsupported_file";
    public static final String EDIT_FAILED = "edit_failed";

    private final String code;

    public FileBackendException(String code, String message) {
        super(message);
        this.code = code;
    }

    public FileBackendException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static FileBackendException notFound(String path) {
        return new FileBackendException(NOT_FOUND, "File not found: " + path);
    }
}
