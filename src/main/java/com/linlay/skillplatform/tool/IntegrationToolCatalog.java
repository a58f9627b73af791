package com.linlay.skillplatform.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class IntegrationToolCatalog {

    private static final Logger log = LoggerFactory.getLogger(IntegrationToolCatalog.class);

    private final Map<IntegrationName, IntegrationToolProvider> providers;

    public IntegrationToolCatalog(List<IntegrationToolProvider> providers) {
        Map<IntegrationName, IntegrationToolProvider> byName = new LinkedHashMap<>();
        for (IntegrationToolProvider provider : providers == null ? List.<IntegrationToolProvider>of() : providers) {
            if (byName.putIfAbsent(provider.integrationName(), provider) != null) {
                log.warn("Duplicate integration provider '{}', keeping the first registration", provider.integrationName());
            }
        }
        this.providers = byName;
    }

    @Autowired
    public IntegrationToolCatalog(ObjectProvider<IntegrationToolProvider> providers) {
        this(providers.orderedStream().toList());
    }

    public List<BaseTool> loadTools(IntegrationName name) {
        IntegrationToolProvider provider = providers.get(name);
        if (provider == null) {
            log.warn("No provider registered for integration '{}'", name);
            return List.of();
        }
        List<BaseTool> tools = provider.loadTools();
        return tools == null ? List.of() : List.copyOf(tools);
    }
}
