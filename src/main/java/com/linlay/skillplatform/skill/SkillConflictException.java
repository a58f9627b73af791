package com.linlay.skillplatform.skill;

public class SkillConflictException extends SkillException {

    public SkillConflictException(String message) {
        super(message);
    }
}
