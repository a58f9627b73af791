package com.linlay.skillplatform.agent.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.linlay.skillplatform.skill.SkillDependencies;
import com.linlay.skillplatform.skill.SkillSessionSnapshot;
import com.linlay.skillplatform.tool.BaseTool;
import com.linlay.skillplatform.tool.IntegrationName;
import com.linlay.skillplatform.tool.ToolName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SkillDependencyBundleTest {

    @Test
    void shouldMoveDependenciesRedeclaredByLaterActivationsToTheEnd() {
        SkillSessionSnapshot snapshot = snapshot(Map.of(
                "a", SkillDependencies.fromStrings(List.of("web_search", "shell"), List.of("github"), List.of("c")),
                "b", SkillDependencies.fromStrings(List.of("web_search"), List.of("gitlab", "github"), List.of())));

        SkillDependencyBundle bundle = SkillDependencyBundle.of(List.of("a", "b"), snapshot);

        assertThat(bundle.activatedSkills()).containsExactly("a", "b");
        assertThat(bundle.tools()).containsExactly(ToolName.of("shell"), ToolName.of("web_search"));
        assertThat(bundle.integrations()).containsExactly(IntegrationName.of("gitlab"), IntegrationName.of("github"));
        assertThat(bundle.skills()).containsExactly("c");
    }

    @Test
    void shouldBeEmptyWithoutActivations() {
        SkillSessionSnapshot snapshot = snapshot(Map.of(
                "a", SkillDependencies.fromStrings(List.of("shell"), List.of(), List.of())));

        assertThat(SkillDependencyBundle.of(List.of(), snapshot)).isSameAs(SkillDependencyBundle.EMPTY);
        assertThat(SkillDependencyBundle.of(List.of("a"), null)).isSameAs(SkillDependencyBundle.EMPTY);
        assertThat(SkillDependencyBundle.of(List.of("unknown"), snapshot).isEmpty()).isTrue();
    }

    @Test
    void shouldApplyIntegrationToolsOverDeclaredToolsAndReportMissing() {
        SkillDependencyBundle bundle = new SkillDependencyBundle(
                List.of("a"),
                List.of(ToolName.of("create_issue"), ToolName.of("missing_tool")),
                List.of(IntegrationName.of("gitlab"), IntegrationName.of("github")),
                List.of());
        Map<String, BaseTool> target = new LinkedHashMap<>();

        List<ToolName> missing = bundle.applyTo(
                target,
                name -> "create_issue".equals(name.value())
                        ? Optional.of(new StubTool("create_issue", "registry"))
                        : Optional.empty(),
                integration -> List.of(new StubTool("Create_Issue ", integration.value())));

        assertThat(missing).containsExactly(ToolName.of("missing_tool"));
        assertThat(target).containsOnlyKeys("create_issue");
        assertThat(target.get("create_issue").description()).isEqualTo("github");
    }

    private static SkillSessionSnapshot snapshot(Map<String, SkillDependencies> dependencies) {
        List<String> visible = List.copyOf(dependencies.keySet());
        return new SkillSessionSnapshot(visible, visible, Map.of(), dependencies);
    }

    record StubTool(String name, String description) implements BaseTool {

        @Override
        public JsonNode invoke(Map<String, Object> args) {
            return JsonNodeFactory.instance.objectNode().put("tool", name);
        }
    }
}
