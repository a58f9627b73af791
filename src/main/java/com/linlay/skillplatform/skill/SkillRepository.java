package com.linlay.skillplatform.skill;

import java.util.List;
import java.util.Optional;

public interface SkillRepository {

    List<SkillRecord> listAll();

    Optional<SkillRecord> findBySlug(String slug);

    default boolean existsSlug(String slug) {
        return findBySlug(slug).isPresent();
    }

    SkillRecord create(NewSkill skill);

    SkillRecord updateMetadata(String slug, String name, String description, String updatedBy);

    SkillRecord updateDependencies(String slug, SkillDependencies dependencies, String updatedBy);

    void delete(String slug);

    record NewSkill(
            String slug,
            String name,
            String description,
            String dirPath,
            SkillDependencies dependencies,
            String createdBy
    ) {
    }
}
