package com.linlay.skillplatform.agent.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.linlay.skillplatform.agent.PlannedToolCall;
import com.linlay.skillplatform.backend.SkillFileBackendFactory;
import com.linlay.skillplatform.skill.FileSkillRepository;
import com.linlay.skillplatform.skill.SkillCatalogProperties;
import com.linlay.skillplatform.skill.SkillContentStore;
import com.linlay.skillplatform.skill.SkillDependencyResolver;
import com.linlay.skillplatform.skill.SkillMetadataCache;
import com.linlay.skillplatform.tool.BaseTool;
import com.linlay.skillplatform.tool.IntegrationToolCatalog;
import com.linlay.skillplatform.tool.ToolRegistry;
import com.linlay.skillplatform.tool.file.ReadFileTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

class TurnContextFactoryTest {

    @TempDir
    Path dataDir;

    private SkillContentStore store;
    private TurnContextFactory factory;
    private SkillSessionManager sessionManager;

    @BeforeEach
    void setUp() throws IOException {
        FileSkillRepository repository = new FileSkillRepository(
                new ObjectMapper(), dataDir.resolve("skills.json"), Clock.systemUTC());
        SkillMetadataCache cache = new SkillMetadataCache();
        store = new SkillContentStore(repository, cache, dataDir, 1024 * 1024);
        store.importArchive("demo.zip", zip("demo", "Demo skill", "tools: [web_search]\n"), "alice");
        store.importArchive("other.zip", zip("other", "Other skill", ""), "alice");

        ToolRegistry registry = new ToolRegistry(List.of(
                new StubTool("web_search"),
                new StubTool("read_file")
        ));
        SkillCatalogProperties properties = new SkillCatalogProperties();
        properties.setMaxReadLines(100);
        factory = new TurnContextFactory(registry, new SkillFileBackendFactory(store), properties);
        sessionManager = new SkillSessionManager(
                new SkillDependencyResolver(cache),
                registry,
                new IntegrationToolCatalog(List.of()),
                new ObjectMapper()
        );
    }

    @Test
    void shouldPreferFileToolsOverRegistryToolsWithSameName() {
        TurnContext context = factory.open("chat-1", "run-1", List.of("demo"), "sys", List.of());

        List<String> names = context.baseTools().stream().map(BaseTool::name).toList();
        assertThat(names).containsExactly("ls", "read_file", "write_file", "edit_file", "web_search");
        assertThat(context.baseTools().get(1)).isInstanceOf(ReadFileTool.class);
    }

    @Test
    void shouldActivateSkillThroughRoutedReadFile() {
        TurnContext context = factory.open("chat-1", "run-1", List.of("demo"), "sys", List.of());
        BaseTool readFile = tool(context, "read_file");

        sessionManager.beforeTurn(context);
        ModelCallRequest before = sessionManager.beforeModelCall(context, ModelCallRequest.from(context));
        assertThat(before.systemPrompt()).contains("Read `/skills/demo/SKILL.md` for full instructions");
        assertThat(before.tools()).doesNotContainKey("web_search");

        JsonNode result = sessionManager.onToolCall(
                context,
                new PlannedToolCall("read_file", Map.of("file_path", "/skills/demo/SKILL.md"), "call-1"),
                call -> readFile.invoke(call.arguments())
        );
        assertThat(result.path("ok").asBoolean()).isTrue();
        assertThat(result.path("content").asText()).contains("description: Demo skill");

        ModelCallRequest after = sessionManager.beforeModelCall(context, ModelCallRequest.from(context));
        assertThat(after.tools()).containsKey("web_search");
    }

    @Test
    void shouldHideSkillsOutsideTheTurn() {
        TurnContext context = factory.open("chat-1", "run-1", List.of("demo"), "sys", List.of());
        sessionManager.beforeTurn(context);

        JsonNode listing = tool(context, "ls").invoke(Map.of("path", "/skills"));
        assertThat(listing.path("entries")).hasSize(1);
        assertThat(listing.path("entries").get(0).path("path").asText()).isEqualTo("/skills/demo/");

        JsonNode hidden = tool(context, "read_file").invoke(Map.of("file_path", "/skills/other/SKILL.md"));
        assertThat(hidden.path("code").asText()).isEqualTo("not_found");

        JsonNode write = tool(context, "write_file").invoke(Map.of("file_path", "/skills/demo/notes.md", "content", "x"));
        assertThat(write.path("code").asText()).isEqualTo("read_only");
        assertThat(store.skillsRoot().resolve("demo/notes.md")).doesNotExist();
    }

    @Test
    void shouldKeepScratchFilesInTurnState() {
        TurnContext context = factory.open("chat-1", "run-1", List.of(), "sys", List.of());

        JsonNode write = tool(context, "write_file").invoke(Map.of("file_path", "/notes/plan.md", "content", "step 1"));
        JsonNode read = tool(context, "read_file").invoke(Map.of("file_path", "/notes/plan.md"));

        assertThat(write.path("ok").asBoolean()).isTrue();
        assertThat(read.path("content").asText()).contains("step 1");
        assertThat(context.state()).containsKey("files");
    }

    private static BaseTool tool(TurnContext context, String name) {
        return context.baseTools().stream()
                .filter(tool -> name.equals(tool.name()))
                .findFirst()
                .orElseThrow();
    }

    private static byte[] zip(String name, String description, String extra) throws IOException {
        String manifest = "---\nname: " + name + "\ndescription: " + description + "\n" + extra + "---\n# " + name + "\n";
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.putNextEntry(new ZipEntry("SKILL.md"));
            zip.write(manifest.getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }
        return out.toByteArray();
    }

    record StubTool(String name) implements BaseTool {

        @Override
        public JsonNode invoke(Map<String, Object> args) {
            return JsonNodeFactory.instance.objectNode().put("tool", name);
        }
    }
}
