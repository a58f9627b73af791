package com.linlay.skillplatform.skill;

public class SkillNotFoundException extends SkillException {

    public SkillNotFoundException(String message) {
        super(message);
    }

    public static SkillNotFoundException skill(String slug) {
        return new SkillNotFoundException("skill not found: " + slug);
    }
}
