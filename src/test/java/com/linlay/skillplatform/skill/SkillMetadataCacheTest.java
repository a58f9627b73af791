package com.linlay.skillplatform.skill;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(OutputCaptureExtension.class)
class SkillMetadataCacheTest {

    @Test
    void shouldExposeOptionsAndPromptMetadata() {
        SkillMetadataCache cache = new SkillMetadataCache();
        cache.rebuild(List.of(record(2, "beta", List.of()), record(1, "alpha", List.of("beta"))));

        assertThat(cache.options()).extracting(SkillMetadataCache.SkillOption::id).containsExactly("beta", "alpha");
        assertThat(cache.find("alpha").orElseThrow().dependencies().skills()).containsExactly("beta");
        assertThat(cache.promptMetadata(List.of("alpha", "missing", "beta", "alpha")))
                .extracting(SkillMetadataCache.SkillPromptMetadata::path)
                .containsExactly("/skills/alpha/SKILL.md", "/skills/beta/SKILL.md");
    }

    @Test
    void shouldReplaceSnapshotOnRebuild() {
        SkillMetadataCache cache = new SkillMetadataCache();
        cache.rebuild(List.of(record(1, "alpha", List.of())));
        cache.rebuild(List.of(record(2, "beta", List.of())));

        assertThat(cache.contains("alpha")).isFalse();
        assertThat(cache.contains("beta")).isTrue();
    }

    @Test
    void shouldIgnoreInvalidStoredDependencies() {
        SkillMetadataCache cache = new SkillMetadataCache();
        cache.rebuild(List.of(record(1, "alpha", List.of("Not A Slug"))));

        assertThat(cache.find("alpha").orElseThrow().dependencies().isEmpty()).isTrue();
    }

    @Test
    void shouldStayEmptyWhenRepositoryFailsAtStartup(CapturedOutput output) {
        SkillRepository repository = mock(SkillRepository.class);
        when(repository.listAll()).thenThrow(new IllegalStateException("db down"));

        SkillMetadataCache cache = new SkillMetadataCache(repository);

        assertThat(cache.options()).isEmpty();
        assertThat(output.getOut()).contains("Failed to initialize skills cache");
    }

    static SkillRecord record(long id, String slug, List<String> skillDependencies) {
        return new SkillRecord(id, slug, slug, slug + " skill", "skills/" + slug,
                List.of(), List.of(), skillDependencies, "alice", "alice", id, id);
    }
}
