package com.linlay.skillplatform.skill;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.linlay.skillplatform.skill.SkillMetadataCacheTest.record;
import static org.assertj.core.api.Assertions.assertThat;

class SkillDependencyResolverTest {

    private final SkillMetadataCache cache = new SkillMetadataCache();
    private final SkillDependencyResolver resolver = new SkillDependencyResolver(cache);

    @Test
    void shouldAddTransitiveDependenciesAfterSelectedSkills() {
        cache.rebuild(List.of(record(1, "a", List.of("b")), record(2, "b", List.of())));

        SkillSessionSnapshot snapshot = resolver.resolve(List.of("a"));

        assertThat(snapshot.selectedSkills()).containsExactly("a");
        assertThat(snapshot.visibleSkills()).containsExactly("a", "b");
        assertThat(snapshot.dependencyMap()).containsOnlyKeys("a", "b");
        assertThat(snapshot.promptMetadata().keySet()).containsExactly("a", "b");
    }

    @Test
    void shouldKeepSelectedOrderThenDiscoveryOrder() {
        cache.rebuild(List.of(
                record(1, "x", List.of("z", "y")),
                record(2, "y", List.of()),
                record(3, "z", List.of("w")),
                record(4, "w", List.of()),
                record(5, "v", List.of())));

        SkillSessionSnapshot snapshot = resolver.resolve(List.of("v", "x"));

        assertThat(snapshot.visibleSkills()).containsExactly("v", "x", "z", "y", "w");
    }

    @Test
    void shouldTerminateOnCyclesWithoutDuplicates() {
        cache.rebuild(List.of(
                record(1, "a", List.of("b")),
                record(2, "b", List.of("c")),
                record(3, "c", List.of("a", "b"))));

        SkillSessionSnapshot snapshot = resolver.resolve(List.of("b", "a"));

        assertThat(snapshot.visibleSkills()).containsExactly("b", "a", "c");
    }

    @Test
    void shouldBeFixedPointOnAcyclicGraph() {
        cache.rebuild(List.of(
                record(1, "a", List.of("b", "c")),
                record(2, "b", List.of("d")),
                record(3, "c", List.of("d")),
                record(4, "d", List.of())));

        List<String> first = resolver.resolve(List.of("a")).visibleSkills();
        List<String> second = resolver.resolve(first).visibleSkills();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldDropInvalidUnknownAndDuplicateSlugs() {
        cache.rebuild(List.of(record(1, "a", List.of("ghost")), record(2, "b", List.of())));

        SkillSessionSnapshot snapshot = resolver.resolve(Arrays.asList("b", null, "Bad Slug", "missing", "a", "b"));

        assertThat(snapshot.selectedSkills()).containsExactly("b", "a");
        assertThat(snapshot.visibleSkills()).containsExactly("b", "a");
    }

    @Test
    void shouldReturnEmptySnapshotForEmptySelection() {
        assertThat(resolver.resolve(List.of()).visibleSkills()).isEmpty();
        assertThat(resolver.resolve(null).visibleSkills()).isEmpty();
    }
}
