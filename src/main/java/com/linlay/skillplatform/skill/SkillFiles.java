package com.linlay.skillplatform.skill;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

public final class SkillFiles {

    private static final Logger log = LoggerFactory.getLogger(SkillFiles.class);

    static final Set<String> TEXT_FILE_EXTENSIONS = Set.of(
            ".md", ".txt", ".py", ".js", ".ts", ".json", ".yaml", ".yml", ".toml", ".ini",
            ".cfg", ".conf", ".xml", ".html", ".css", ".sql", ".sh", ".bat", ".ps1", ".env",
            ".csv", ".tsv", ".rst", ".ipynb", ".vue", ".jsx", ".tsx"
    );

    private SkillFiles() {
    }

    public static boolean isTextPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        if (SkillManifest.FILE_NAME.equals(name)) {
            return true;
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return TEXT_FILE_EXTENSIONS.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    public static String readUtf8(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException ex) {
            throw new SkillValidationException("unsupported file encoding (UTF-8 only): " + file.getFileName(), ex);
        }
    }

    /**
     * Resolves symlinks of the longest existing prefix of {@code path}; the rest is appended as-is.
     */
    static Path realPath(Path path) throws IOException {
        Path absolute = path.toAbsolutePath().normalize();
        Path existing = absolute;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return absolute;
        }
        return existing.toRealPath().resolve(existing.relativize(absolute)).normalize();
    }

    static String toPosix(Path relative) {
        return relative.toString().replace('\\', '/');
    }

    static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(path);
        } catch (IOException ex) {
            log.warn("Cannot remove {}", path, ex);
        }
    }
}
