package com.linlay.skillplatform.backend;

import com.linlay.skillplatform.skill.SkillContentStore;
import com.linlay.skillplatform.skill.SkillContentStore.ResolvedPath;
import com.linlay.skillplatform.skill.SkillFiles;
import com.linlay.skillplatform.skill.SkillSlugs;
import com.linlay.skillplatform.skill.SkillValidationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Read-only view of the skill directories visible to the current turn.
 * <p>
 * Paths are relative to the {@code /skills/} route, so {@code /demo/SKILL.md} addresses
 * {@code /skills/demo/SKILL.md}. A slug that is not visible behaves exactly like a missing one.
 */
public class SkillsReadonlyBackend implements FileBackend {

    private final SkillContentStore contentStore;
    private final Supplier<? extends Collection<String>> visibleSkills;

    public SkillsReadonlyBackend(SkillContentStore contentStore, Supplier<? extends Collection<String>> visibleSkills) {
        this.contentStore = contentStore;
        this.visibleSkills = visibleSkills;
    }

    @Override
    public List<FileInfo> ls(String path) {
        String normalized = FilePaths.normalize(path);
        if ("/".equals(normalized)) {
            List<FileInfo> roots = new ArrayList<>();
            for (String slug : visible()) {
                if (Files.isDirectory(contentStore.skillDirectory(slug))) {
                    roots.add(FileInfo.directory("/" + slug));
                }
            }
            return roots;
        }

        Target target = target(normalized);
        ResolvedPath resolved = resolve(target, true);
        if (!Files.isDirectory(resolved.path())) {
            throw FileBackendException.notFound(path);
        }
        List<FileInfo> items = new ArrayList<>();
        try (Stream<Path> children = Files.list(resolved.path())) {
            for (Path child : children.sorted(Comparator.comparing(p -> p.getFileName().toString().toLowerCase(Locale.ROOT))).toList()) {
                if (Files.isSymbolicLink(child)) {
                    continue;
                }
                String childPath = "/" + target.slug() + "/"
                        + (resolved.relativePath().isEmpty() ? "" : trimSlashes(resolved.relativePath()) + "/")
                        + child.getFileName();
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    items.add(FileInfo.directory(childPath));
                } else {
                    items.add(FileInfo.file(childPath, Files.size(child)));
                }
            }
        } catch (IOException ex) {
            throw new FileBackendException(FileBackendException.NOT_FOUND, "Cannot list " + path, ex);
        }
        items.sort(Comparator.comparing(info -> !info.directory()));
        return items;
    }

    @Override
    public String read(String path) {
        Target target = target(FilePaths.normalize(path));
        ResolvedPath resolved = resolve(target, false);
        if (!Files.isRegularFile(resolved.path())) {
            throw FileBackendException.notFound(path);
        }
        if (!SkillFiles.isTextPath(resolved.path())) {
            throw new FileBackendException(FileBackendException.UNSUPPORTED_FILE, "Only text files can be read: " + path);
        }
        try {
            return SkillFiles.readUtf8(resolved.path());
        } catch (SkillValidationException ex) {
            throw new FileBackendException(FileBackendException.UNSUPPORTED_FILE, ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new FileBackendException(FileBackendException.NOT_FOUND, "Cannot read " + path, ex);
        }
    }

    @Override
    public void write(String path, String content) {
        throw readOnly(path);
    }

    @Override
    public int edit(String path, String oldString, String newString, boolean replaceAll) {
        throw readOnly(path);
    }

    private Target target(String normalized) {
        String trimmed = trimSlashes(normalized);
        int slash = trimmed.indexOf('/');
        String slug = slash < 0 ? trimmed : trimmed.substring(0, slash);
        String rest = slash < 0 ? "" : trimmed.substring(slash + 1);
        if (!SkillSlugs.isValid(slug) || !visible().contains(slug)) {
            throw FileBackendException.notFound(normalized);
        }
        return new Target(slug, rest);
    }

    private ResolvedPath resolve(Target target, boolean allowRoot) {
        try {
            return contentStore.resolvePath(contentStore.skillDirectory(target.slug()), target.rest(), allowRoot);
        } catch (SkillValidationException ex) {
            throw new FileBackendException(FileBackendException.INVALID_PATH, ex.getMessage(), ex);
        }
    }

    private Collection<String> visible() {
        Collection<String> slugs = visibleSkills.get();
        return slugs == null ? List.of() : slugs;
    }

    private static FileBackendException readOnly(String path) {
        return new FileBackendException(FileBackendException.READ_ONLY, "Skills directory is read-only: " + path);
    }

    private static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }

    private record Target(String slug, String rest) {
    }
}
