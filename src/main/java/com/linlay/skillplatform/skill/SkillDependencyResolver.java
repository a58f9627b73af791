package com.linlay.skillplatform.skill;

import com.linlay.skillplatform.skill.SkillMetadataCache.SkillMetadata;
import com.linlay.skillplatform.skill.SkillMetadataCache.SkillPromptMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the visible-skill closure of a turn from the metadata cache only.
 * <p>
 * Selected slugs come first in input order, followed by transitively required skills in discovery
 * order. Invalid or unknown slugs are dropped. Cycles are cut by the visited set.
 */
@Component
public class SkillDependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(SkillDependencyResolver.class);

    private final SkillMetadataCache metadataCache;

    public SkillDependencyResolver(SkillMetadataCache metadataCache) {
        this.metadataCache = metadataCache;
    }

    public SkillSessionSnapshot resolve(Collection<String> selectedSkills) {
        List<String> selected = new ArrayList<>();
        for (String slug : SkillSlugs.normalizeSelected(selectedSkills)) {
            if (metadataCache.contains(slug)) {
                selected.add(slug);
            } else {
                log.debug("Selected skill '{}' is unknown, dropping it", slug);
            }
        }
        if (selected.isEmpty()) {
            return SkillSessionSnapshot.EMPTY;
        }

        Set<String> visited = new LinkedHashSet<>(selected);
        Deque<String> queue = new ArrayDeque<>(selected);
        Map<String, SkillPromptMetadata> promptMetadata = new LinkedHashMap<>();
        Map<String, SkillDependencies> dependencyMap = new LinkedHashMap<>();
        while (!queue.isEmpty()) {
            String slug = queue.poll();
            Optional<SkillMetadata> metadata = metadataCache.find(slug);
            if (metadata.isEmpty()) {
                continue;
            }
            for (String dependency : metadata.get().dependencies().skills()) {
                if (visited.contains(dependency)) {
                    continue;
                }
                if (!metadataCache.contains(dependency)) {
                    log.debug("Skill '{}' requires unknown skill '{}', skipping", slug, dependency);
                    continue;
                }
                visited.add(dependency);
                queue.add(dependency);
            }
        }

        for (String slug : visited) {
            metadataCache.find(slug).ifPresent(item -> {
                promptMetadata.put(slug, item.promptMetadata());
                dependencyMap.put(slug, item.dependencies());
            });
        }
        return new SkillSessionSnapshot(selected, List.copyOf(visited), promptMetadata, dependencyMap);
    }
}
