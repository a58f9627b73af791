package com.linlay.skillplatform.skill;

import java.io.IOException;

public class SkillStorageException extends SkillException {

    public SkillStorageException(String message, IOException cause) {
        super(message, cause);
    }
}
