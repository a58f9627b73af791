package com.linlay.skillplatform.skill;

public class SkillPathViolationException extends SkillValidationException {

    public SkillPathViolationException(String message) {
        super(message);
    }
}
