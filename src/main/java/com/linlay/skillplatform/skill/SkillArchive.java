package com.linlay.skillplatform.skill;

import java.nio.file.Path;

/**
 * Exported zip written to a private temporary file. The caller deletes {@code file} when done.
 */
public record SkillArchive(Path file, String filename) {
}
