package com.linlay.skillplatform.skill;

public record SkillFileContent(String path, String content) {
}
