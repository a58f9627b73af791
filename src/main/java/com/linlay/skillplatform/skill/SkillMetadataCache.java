package com.linlay.skillplatform.skill;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-wide, read-mostly view of skill display metadata and dependency declarations.
 * <p>
 * Readers never block and never touch disk; writers replace the whole snapshot under a single lock.
 */
@Component
public class SkillMetadataCache {

    private static final Logger log = LoggerFactory.getLogger(SkillMetadataCache.class);

    public static final String VIRTUAL_ROOT = "/skills/";

    private final Object rebuildLock = new Object();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public SkillMetadataCache() {
    }

    @Autowired
    public SkillMetadataCache(SkillRepository repository) {
        initialize(repository);
    }

    /**
     * Startup load; a failing repository leaves the cache empty instead of failing the caller.
     */
    public void initialize(SkillRepository repository) {
        try {
            rebuild(repository.listAll());
        } catch (RuntimeException ex) {
            log.warn("Failed to initialize skills cache", ex);
        }
    }

    public void rebuild(Collection<SkillRecord> records) {
        synchronized (rebuildLock) {
            Map<String, SkillMetadata> bySlug = new LinkedHashMap<>();
            for (SkillRecord record : records) {
                if (record == null || !SkillSlugs.isValid(record.slug())) {
                    continue;
                }
                SkillDependencies dependencies;
                try {
                    dependencies = record.dependencies();
                } catch (SkillValidationException ex) {
                    log.warn("Skill '{}' has invalid stored dependencies, ignoring them: {}", record.slug(), ex.getMessage());
                    dependencies = SkillDependencies.NONE;
                }
                bySlug.put(record.slug(), new SkillMetadata(
                        record.slug(),
                        record.name(),
                        record.description(),
                        manifestPath(record.slug()),
                        dependencies
                ));
            }
            snapshot = new Snapshot(Map.copyOf(bySlug), List.copyOf(bySlug.values()));
            log.info("Rebuilt skills cache with {} items", bySlug.size());
        }
    }

    public Optional<SkillMetadata> find(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.bySlug().get(slug));
    }

    public boolean contains(String slug) {
        return slug != null && snapshot.bySlug().containsKey(slug);
    }

    public List<SkillOption> options() {
        return snapshot.ordered().stream()
                .map(item -> new SkillOption(item.slug(), item.name(), item.description()))
                .toList();
    }

    public List<SkillPromptMetadata> promptMetadata(Collection<String> slugs) {
        if (slugs == null || slugs.isEmpty()) {
            return List.of();
        }
        Map<String, SkillMetadata> bySlug = snapshot.bySlug();
        Set<String> seen = new LinkedHashSet<>();
        List<SkillPromptMetadata> result = new ArrayList<>();
        for (String slug : slugs) {
            if (slug == null || !seen.add(slug)) {
                continue;
            }
            SkillMetadata item = bySlug.get(slug);
            if (item == null) {
                log.debug("Skill slug not found in cache, skip prompt metadata: {}", slug);
                continue;
            }
            result.add(item.promptMetadata());
        }
        return List.copyOf(result);
    }

    public static String manifestPath(String slug) {
        return VIRTUAL_ROOT + slug + "/" + SkillManifest.FILE_NAME;
    }

    public record SkillMetadata(
            String slug,
            String name,
            String description,
            String manifestPath,
            SkillDependencies dependencies
    ) {
        public SkillPromptMetadata promptMetadata() {
            return new SkillPromptMetadata(slug, name, description, manifestPath);
        }
    }

    public record SkillPromptMetadata(String slug, String name, String description, String path) {
    }

    public record SkillOption(String id, String name, String description) {
    }

    private record Snapshot(Map<String, SkillMetadata> bySlug, List<SkillMetadata> ordered) {
        private static final Snapshot EMPTY = new Snapshot(Map.of(), List.of());
    }
}
