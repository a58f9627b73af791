package com.linlay.skillplatform.tool;

import java.util.List;

public interface IntegrationToolProvider {

    IntegrationName integrationName();

    /**
     * Fetches the integration's tools. Implementations may block on remote I/O and may throw.
     */
    List<BaseTool> loadTools();
}
