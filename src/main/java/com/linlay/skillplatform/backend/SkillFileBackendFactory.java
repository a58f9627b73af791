package com.linlay.skillplatform.backend;

import com.linlay.skillplatform.agent.runtime.TurnContext;
import com.linlay.skillplatform.skill.SkillContentStore;
import com.linlay.skillplatform.skill.SkillMetadataCache;
import com.linlay.skillplatform.skill.SkillSlugs;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class SkillFileBackendFactory {

    private final SkillContentStore contentStore;

    public SkillFileBackendFactory(SkillContentStore contentStore) {
        this.contentStore = contentStore;
    }

    public FileBackend create(TurnContext context) {
        return new CompositeFileBackend(
                new StateFileBackend(context.state()),
                Map.of(SkillMetadataCache.VIRTUAL_ROOT, new SkillsReadonlyBackend(contentStore, () -> visibleSkills(context)))
        );
    }

    static List<String> visibleSkills(TurnContext context) {
        return context.visibleSkills().stream()
                .filter(SkillSlugs::isValid)
                .toList();
    }
}
