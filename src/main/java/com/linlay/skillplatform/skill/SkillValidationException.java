package com.linlay.skillplatform.skill;

public class SkillValidationException extends SkillException {

    public SkillValidationException(String message) {
        super(message);
    }

    public SkillValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
