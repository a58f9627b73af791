package com.linlay.skillplatform.tool.file;

import com.linlay.skillplatform.backend.FileBackend;
import com.linlay.skillplatform.tool.BaseTool;

import java.util.List;

public final class FileToolset {

    private FileToolset() {
    }

    public static List<BaseTool> forTurn(FileBackend backend, int maxReadLines) {
        return List.of(
                new ListFilesTool(backend),
                new ReadFileTool(backend, maxReadLines),
                new WriteFileTool(backend),
                new EditFileTool(backend)
        );
    }
}
