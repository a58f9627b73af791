package com.linlay.skillplatform.model.api;

import com.linlay.skillplatform.skill.SkillRecord;

import java.util.List;

public record SkillDetailResponse(
        SkillDetail skill
) {
    public record SkillDetail(
            long id,
            String skillId,
            String name,
            String description,
            List<String> tools,
            List<String> integrations,
            List<String> skills,
            String createdBy,
            String updatedBy,
            long createdAt,
            long updatedAt
    ) {
        public static SkillDetail from(SkillRecord record) {
            return new SkillDetail(
                    record.id(),
                    record.slug(),
                    record.name(),
                    record.description(),
                    record.toolDependencies(),
                    record.integrationDependencies(),
                    record.skillDependencies(),
                    record.createdBy(),
                    record.updatedBy(),
                    record.createdAt(),
                    record.updatedAt()
            );
        }
    }
}
