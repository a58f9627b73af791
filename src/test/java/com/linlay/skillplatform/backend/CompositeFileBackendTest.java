package com.linlay.skillplatform.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.skillplatform.skill.FileSkillRepository;
import com.linlay.skillplatform.skill.SkillContentStore;
import com.linlay.skillplatform.skill.SkillMetadataCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class CompositeFileBackendTest {

    @TempDir
    Path dataDir;

    private final Map<String, Object> state = new HashMap<>();
    private final List<String> visible = new ArrayList<>();
    private CompositeFileBackend backend;

    @BeforeEach
    void setUp() throws Exception {
        for (String slug : List.of("alpha", "beta")) {
            Path skillDir = Files.createDirectories(dataDir.resolve("skills").resolve(slug).resolve("docs"));
            Files.writeString(skillDir.getParent().resolve("SKILL.md"), "---\nname: " + slug + "\ndescription: d\n---\n");
            Files.writeString(skillDir.resolve("guide.md"), "line one\nline two\n");
        }
        Files.write(dataDir.resolve("skills/alpha/logo.png"), new byte[]{1, 2});
        SkillContentStore store = new SkillContentStore(
                new FileSkillRepository(new ObjectMapper(), dataDir.resolve("skills.json"), Clock.systemUTC()),
                new SkillMetadataCache(),
                dataDir,
                1024
        );
        visible.add("alpha");
        backend = new CompositeFileBackend(
                new StateFileBackend(state),
                Map.of("/skills/", new SkillsReadonlyBackend(store, () -> visible))
        );
    }

    @Test
    void shouldRouteSkillPathsToReadonlyView() {
        assertThat(backend.read("/skills/alpha/docs/guide.md")).isEqualTo("line one\nline two\n");
        assertThat(backend.read("\\skills\\alpha//SKILL.md")).startsWith("---\nname: alpha");
    }

    @Test
    void shouldListOnlyVisibleSkills() {
        assertThat(backend.ls("/skills/")).extracting(FileInfo::path).containsExactly("/skills/alpha/");
        assertThat(backend.ls("/skills/alpha")).extracting(FileInfo::path)
                .containsExactly("/skills/alpha/docs/", "/skills/alpha/logo.png", "/skills/alpha/SKILL.md");
    }

    @Test
    void shouldSkipSymbolicLinksWhenListing() throws Exception {
        Path outside = Files.writeString(dataDir.resolve("secret.txt"), "top secret");
        boolean linked;
        try {
            Files.createSymbolicLink(dataDir.resolve("skills/alpha/secret.txt"), outside);
            Files.createSymbolicLink(dataDir.resolve("skills/alpha/dangling.md"), dataDir.resolve("missing.md"));
            linked = true;
        } catch (IOException | UnsupportedOperationException ex) {
            linked = false;
        }
        assumeTrue(linked);

        assertThat(backend.ls("/skills/alpha")).extracting(FileInfo::path)
                .containsExactly("/skills/alpha/docs/", "/skills/alpha/logo.png", "/skills/alpha/SKILL.md");
    }

    @Test
    void shouldTreatInvisibleSkillsAsMissing() {
        assertThatThrownBy(() -> backend.read("/skills/beta/SKILL.md"))
                .isInstanceOf(FileBackendException.class)
                .extracting(ex -> ((FileBackendException) ex).code())
                .isEqualTo(FileBackendException.NOT_FOUND);
        assertThatThrownBy(() -> backend.ls("/skills/beta"))
                .isInstanceOf(FileBackendException.class);

        visible.add("beta");

        assertThat(backend.read("/skills/beta/SKILL.md")).contains("name: beta");
    }

    @Test
    void shouldRejectWritesUnderSkills() {
        assertThatThrownBy(() -> backend.write("/skills/alpha/new.md", "x"))
                .isInstanceOf(FileBackendException.class)
                .extracting(ex -> ((FileBackendException) ex).code())
                .isEqualTo(FileBackendException.READ_ONLY);
        assertThatThrownBy(() -> backend.edit("/skills/alpha/docs/guide.md", "one", "1", false))
                .isInstanceOf(FileBackendException.class);
        assertThat(state).isEmpty();
        assertThat(dataDir.resolve("skills/alpha/new.md")).doesNotExist();
    }

    @Test
    void shouldRejectTraversalAndBinaryFiles() {
        assertThatThrownBy(() -> backend.read("/skills/alpha/../beta/SKILL.md"))
                .isInstanceOf(FileBackendException.class)
                .extracting(ex -> ((FileBackendException) ex).code())
                .isEqualTo(FileBackendException.INVALID_PATH);
        assertThatThrownBy(() -> backend.read("/skills/alpha/logo.png"))
                .isInstanceOf(FileBackendException.class)
                .extracting(ex -> ((FileBackendException) ex).code())
                .isEqualTo(FileBackendException.UNSUPPORTED_FILE);
    }

    @Test
    void shouldKeepOtherPathsInTurnState() {
        backend.write("/notes/todo.md", "first");
        backend.edit("/notes/todo.md", "first", "second", false);

        assertThat(backend.read("notes/todo.md")).isEqualTo("second");
        assertThat(backend.ls("/")).extracting(FileInfo::path).containsExactly("/notes/", "/skills/");
        assertThat(backend.ls("/notes")).extracting(FileInfo::path).containsExactly("/notes/todo.md");
        assertThat(state).containsKey(StateFileBackend.FILES_KEY);
    }
}
