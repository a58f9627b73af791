package com.linlay.skillplatform.skill;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSkillRepositoryTest {

    @TempDir
    Path tempDir;

    private final AtomicLong millis = new AtomicLong(1_000L);

    private final Clock clock = new Clock() {
        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis.get());
        }
    };

    @Test
    void shouldCreateAndReloadFromIndexFile() {
        Path index = tempDir.resolve("skills.json");
        FileSkillRepository repository = new FileSkillRepository(new ObjectMapper(), index, clock);

        SkillRecord created = repository.create(newSkill("demo", SkillDependencies.fromStrings(
                List.of("web_search"), List.of("github"), List.of("other"))));

        assertThat(created.id()).isEqualTo(1L);
        assertThat(created.createdAt()).isEqualTo(1_000L);
        assertThat(Files.isRegularFile(index)).isTrue();

        FileSkillRepository reloaded = new FileSkillRepository(new ObjectMapper(), index, clock);
        SkillRecord found = reloaded.findBySlug("demo").orElseThrow();
        assertThat(found.toolDependencies()).containsExactly("web_search");
        assertThat(found.integrationDependencies()).containsExactly("github");
        assertThat(found.skillDependencies()).containsExactly("other");
        assertThat(reloaded.create(newSkill("next", SkillDependencies.NONE)).id()).isEqualTo(2L);
    }

    @Test
    void shouldRejectDuplicateSlug() {
        FileSkillRepository repository = new FileSkillRepository(new ObjectMapper(), tempDir.resolve("skills.json"), clock);
        repository.create(newSkill("demo", SkillDependencies.NONE));

        assertThatThrownBy(() -> repository.create(newSkill("demo", SkillDependencies.NONE)))
                .isInstanceOf(SkillConflictException.class);
    }

    @Test
    void shouldListMostRecentlyUpdatedFirst() {
        FileSkillRepository repository = new FileSkillRepository(new ObjectMapper(), tempDir.resolve("skills.json"), clock);
        repository.create(newSkill("alpha", SkillDependencies.NONE));
        repository.create(newSkill("beta", SkillDependencies.NONE));
        millis.set(5_000L);
        repository.updateMetadata("alpha", "alpha", "changed", "bob");

        assertThat(repository.listAll()).extracting(SkillRecord::slug).containsExactly("alpha", "beta");
        SkillRecord alpha = repository.findBySlug("alpha").orElseThrow();
        assertThat(alpha.description()).isEqualTo("changed");
        assertThat(alpha.updatedBy()).isEqualTo("bob");
        assertThat(alpha.updatedAt()).isEqualTo(5_000L);
    }

    @Test
    void shouldBreakTimestampTiesByHighestId() {
        FileSkillRepository repository = new FileSkillRepository(new ObjectMapper(), tempDir.resolve("skills.json"), clock);
        repository.create(newSkill("alpha", SkillDependencies.NONE));
        repository.create(newSkill("beta", SkillDependencies.NONE));

        assertThat(repository.listAll()).extracting(SkillRecord::slug).containsExactly("beta", "alpha");
    }

    @Test
    void shouldDeleteAndReportMissingSlugs() {
        FileSkillRepository repository = new FileSkillRepository(new ObjectMapper(), tempDir.resolve("skills.json"), clock);
        repository.create(newSkill("demo", SkillDependencies.NONE));

        repository.delete("demo");

        assertThat(repository.existsSlug("demo")).isFalse();
        assertThatThrownBy(() -> repository.delete("demo")).isInstanceOf(SkillNotFoundException.class);
        assertThatThrownBy(() -> repository.updateMetadata("demo", "demo", "d", "x"))
                .isInstanceOf(SkillNotFoundException.class);
    }

    private SkillRepository.NewSkill newSkill(String slug, SkillDependencies dependencies) {
        return new SkillRepository.NewSkill(slug, slug, slug + " description", "skills/" + slug, dependencies, "alice");
    }
}
