package com.linlay.skillplatform.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTest {

    @Test
    void shouldFindToolsCaseInsensitivelyAndKeepFirstDuplicate() {
        BaseTool first = new StubTool("Web_Search", "first");
        BaseTool second = new StubTool("web_search", "second");
        ToolRegistry registry = new ToolRegistry(List.of(first, second, new StubTool("bad name", "x")));

        assertThat(registry.list()).containsExactly(first);
        assertThat(registry.find(ToolName.of("WEB_SEARCH"))).containsSame(first);
        assertThat(registry.invoke("web_search", Map.of()).path("marker").asText()).isEqualTo("first");
    }

    @Test
    void shouldRejectUnknownTools() {
        ToolRegistry registry = new ToolRegistry(List.of());

        assertThatThrownBy(() -> registry.invoke("missing", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void shouldLoadIntegrationToolsPerName() {
        IntegrationToolProvider github = new IntegrationToolProvider() {
            @Override
            public IntegrationName integrationName() {
                return IntegrationName.of("github");
            }

            @Override
            public List<BaseTool> loadTools() {
                return List.of(new StubTool("create_issue", "gh"));
            }
        };
        IntegrationToolCatalog catalog = new IntegrationToolCatalog(List.of(github));

        assertThat(catalog.loadTools(IntegrationName.of("github"))).extracting(BaseTool::name).containsExactly("create_issue");
        assertThat(catalog.loadTools(IntegrationName.of("jira"))).isEmpty();
    }

    @Test
    void shouldValidateNames() {
        assertThat(ToolName.of(" Read_File ").value()).isEqualTo("read_file");
        assertThat(ToolName.isValid("a b")).isFalse();
        assertThatThrownBy(() -> IntegrationName.of("../x")).isInstanceOf(IllegalArgumentException.class);
    }

    record StubTool(String name, String marker) implements BaseTool {

        @Override
        public JsonNode invoke(Map<String, Object> args) {
            return JsonNodeFactory.instance.objectNode().put("marker", marker);
        }
    }
}
