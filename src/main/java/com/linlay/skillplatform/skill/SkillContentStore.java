package com.linlay.skillplatform.skill;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * Sandboxed filesystem operations on skill directories.
 * <p>
 * Every path coming from a caller goes through {@link #resolvePath(Path, String, boolean)}. Mutations
 * that touch both the filesystem and the repository undo the filesystem step when the repository
 * step fails, and the metadata cache is rebuilt after every successful mutation.
 */
@Service
public class SkillContentStore {

    private static final Logger log = LoggerFactory.getLogger(SkillContentStore.class);

    private final SkillRepository repository;
    private final SkillMetadataCache metadataCache;
    private final Path dataDir;
    private final Path skillsRoot;
    private final long maxImportBytes;

    @Autowired
    public SkillContentStore(
            SkillRepository repository,
            SkillMetadataCache metadataCache,
            SkillCatalogProperties properties
    ) {
        this(repository, metadataCache, properties.resolveDataDir(), properties.getMaxImportBytes());
    }

    public SkillContentStore(
            SkillRepository repository,
            SkillMetadataCache metadataCache,
            Path dataDir,
            long maxImportBytes
    ) {
        this.repository = repository;
        this.metadataCache = metadataCache;
        this.dataDir = dataDir.toAbsolutePath().normalize();
        this.skillsRoot = this.dataDir.resolve("skills");
        this.maxImportBytes = maxImportBytes;
    }

    public Path skillsRoot() {
        return skillsRoot;
    }

    public long maxImportBytes() {
        return maxImportBytes;
    }

    // ========= Catalogue =========

    public List<SkillRecord> listSkills() {
        List<SkillRecord> items = repository.listAll();
        metadataCache.rebuild(items);
        return items;
    }

    public SkillRecord getSkill(String slug) {
        return repository.findBySlug(slug).orElseThrow(() -> SkillNotFoundException.skill(slug));
    }

    /**
     * Returns {@code base} if neither the repository nor the skills root knows it, otherwise the first
     * free {@code base-vN} starting at 2.
     */
    public String allocateSlug(String base) {
        String slug = SkillSlugs.requireValidName(base);
        if (isFree(slug)) {
            return slug;
        }
        for (int idx = 2; ; idx++) {
            String suffix = "-v" + idx;
            String prefix = slug;
            if (prefix.length() + suffix.length() > SkillSlugs.MAX_LENGTH) {
                prefix = trimTrailingHyphens(prefix.substring(0, SkillSlugs.MAX_LENGTH - suffix.length()));
            }
            String candidate = prefix + suffix;
            if (isFree(candidate)) {
                return candidate;
            }
        }
    }

    public SkillRecord updateDependencies(String slug, SkillDependencies dependencies, String updatedBy) {
        getSkill(slug);
        SkillDependencies effective = dependencies == null ? SkillDependencies.NONE : dependencies;
        for (String dependency : effective.skills()) {
            if (dependency.equals(slug)) {
                throw new SkillValidationException("skill must not depend on itself: " + slug);
            }
            if (!repository.existsSlug(dependency)) {
                throw new SkillValidationException("unknown skill dependency: " + dependency);
            }
        }
        SkillRecord updated = repository.updateDependencies(slug, effective, updatedBy);
        rebuildCache();
        log.info("Updated dependencies of skill '{}' by {}", slug, updatedBy);
        return updated;
    }

    // ========= Import / export =========

    public SkillRecord importArchive(String filename, byte[] archive, String createdBy) {
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".zip")) {
            throw new SkillValidationException("only .zip uploads are supported");
        }
        if (archive == null || archive.length == 0) {
            throw new SkillValidationException("uploaded archive is empty");
        }
        if (archive.length > maxImportBytes) {
            throw new SkillValidationException("uploaded archive exceeds " + maxImportBytes + " bytes");
        }

        Path staging = null;
        try {
            Files.createDirectories(skillsRoot);
            staging = Files.createTempDirectory(dataDir, ".skill-import-");
            Path zipPath = staging.resolve("upload.zip");
            Path extractDir = staging.resolve("extract");
            Files.write(zipPath, archive);
            extractArchive(zipPath, extractDir);

            Path manifestFile = locateSingleManifest(extractDir);
            Path sourceDir = manifestFile.getParent();
            String content = SkillFiles.readUtf8(manifestFile);
            SkillManifest manifest = SkillManifestParser.parse(content);

            String slug = allocateSlug(manifest.name());
            if (!slug.equals(manifest.name())) {
                content = SkillManifestParser.rewriteName(content, slug);
                Files.writeString(manifestFile, content, StandardCharsets.UTF_8);
            }

            Path stageDir = staging.resolve("stage");
            FileSystemUtils.copyRecursively(sourceDir, stageDir);
            Path published = publish(stageDir, slug);

            SkillRecord created;
            try {
                created = repository.create(new SkillRepository.NewSkill(
                        slug,
                        slug,
                        manifest.description(),
                        "skills/" + slug,
                        manifest.dependencies(),
                        createdBy
                ));
            } catch (RuntimeException ex) {
                SkillFiles.deleteQuietly(published);
                throw ex;
            }
            log.info("Imported skill '{}' from {} by {}", slug, filename, createdBy);
            rebuildCache();
            return created;
        } catch (IOException ex) {
            throw new SkillStorageException("Failed to import skill archive " + filename, ex);
        } finally {
            SkillFiles.deleteQuietly(staging);
        }
    }

    public SkillArchive exportArchive(String slug) {
        SkillRecord record = getSkill(slug);
        Path skillDir = existingSkillDir(record);

        Path exportFile;
        try {
            exportFile = Files.createTempFile("skill-" + slug + "-", ".zip");
        } catch (IOException ex) {
            throw new SkillStorageException("Cannot create export file for " + slug, ex);
        }
        try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(exportFile));
             Stream<Path> walk = Files.walk(skillDir)) {
            for (Path path : walk.sorted().toList()) {
                if (path.equals(skillDir) || Files.isSymbolicLink(path)) {
                    continue;
                }
                String entryName = slug + "/" + SkillFiles.toPosix(skillDir.relativize(path));
                if (Files.isDirectory(path)) {
                    zip.putNextEntry(new ZipEntry(entryName + "/"));
                    zip.closeEntry();
                    continue;
                }
                zip.putNextEntry(new ZipEntry(entryName));
                Files.copy(path, zip);
                zip.closeEntry();
            }
        } catch (IOException ex) {
            SkillFiles.deleteQuietly(exportFile);
            throw new SkillStorageException("Failed to export skill " + slug, ex);
        }
        return new SkillArchive(exportFile, slug + ".zip");
    }

    // ========= Delete =========

    /**
     * Moves the directory to a trash name, deletes the record, then purges the trash. A failed record
     * delete puts the directory back before the error propagates.
     */
    public void deleteSkill(String slug) {
        SkillRecord record = getSkill(slug);
        Path skillDir = resolveSkillDir(record);
        Path trashDir = null;

        if (Files.exists(skillDir, LinkOption.NOFOLLOW_LINKS)) {
            trashDir = skillDir.resolveSibling(".deleted-" + slug + "-" + shortId());
            try {
                Files.move(skillDir, trashDir);
            } catch (IOException ex) {
                throw new SkillStorageException("Cannot move skill directory to trash: " + slug, ex);
            }
        }

        try {
            repository.delete(slug);
        } catch (RuntimeException ex) {
            if (trashDir != null && Files.exists(trashDir, LinkOption.NOFOLLOW_LINKS)) {
                try {
                    Files.move(trashDir, skillDir);
                } catch (IOException restoreEx) {
                    log.error("Cannot restore skill directory {} from {}", skillDir, trashDir, restoreEx);
                    ex.addSuppressed(restoreEx);
                }
            }
            throw ex;
        }

        if (trashDir != null) {
            SkillFiles.deleteQuietly(trashDir);
        }
        log.info("Deleted skill '{}'", slug);
        rebuildCache();
    }

    // ========= Nodes =========

    public List<SkillTreeNode> tree(String slug) {
        Path skillDir = existingSkillDir(getSkill(slug));
        try {
            return buildTree(skillDir, skillDir);
        } catch (IOException ex) {
            throw new SkillStorageException("Cannot list skill directory " + slug, ex);
        }
    }

    public SkillFileContent readFile(String slug, String relativePath) {
        Path skillDir = resolveSkillDir(getSkill(slug));
        ResolvedPath target = resolvePath(skillDir, relativePath, false);
        if (!Files.isRegularFile(target.path())) {
            throw new SkillNotFoundException("file not found: " + relativePath);
        }
        if (!SkillFiles.isTextPath(target.path())) {
            throw new SkillValidationException("only text files can be read: " + relativePath);
        }
        try {
            return new SkillFileContent(target.relativePath(), SkillFiles.readUtf8(target.path()));
        } catch (IOException ex) {
            throw new SkillStorageException("Cannot read " + relativePath, ex);
        }
    }

    public void createNode(String slug, String relativePath, boolean directory, String content, String updatedBy) {
        SkillRecord record = getSkill(slug);
        Path skillDir = resolveSkillDir(record);
        ResolvedPath target = resolvePath(skillDir, relativePath, false);
        if (Files.exists(target.path(), LinkOption.NOFOLLOW_LINKS)) {
            throw new SkillConflictException("target already exists: " + relativePath);
        }

        if (directory) {
            try {
                Files.createDirectories(target.path());
            } catch (IOException ex) {
                throw new SkillStorageException("Cannot create directory " + relativePath, ex);
            }
            return;
        }
        if (!SkillFiles.isTextPath(target.path())) {
            throw new SkillValidationException("only text files can be created: " + relativePath);
        }
        writeText(record, skillDir, target, content == null ? "" : content, updatedBy);
    }

    public void updateFile(String slug, String relativePath, String content, String updatedBy) {
        SkillRecord record = getSkill(slug);
        Path skillDir = resolveSkillDir(record);
        ResolvedPath target = resolvePath(skillDir, relativePath, false);
        if (!Files.isRegularFile(target.path())) {
            throw new SkillNotFoundException("file not found: " + relativePath);
        }
        if (!SkillFiles.isTextPath(target.path())) {
            throw new SkillValidationException("only text files can be edited: " + relativePath);
        }
        writeText(record, skillDir, target, content == null ? "" : content, updatedBy);
    }

    public void deleteNode(String slug, String relativePath) {
        Path skillDir = resolveSkillDir(getSkill(slug));
        ResolvedPath target = resolvePath(skillDir, relativePath, false);
        if (!Files.exists(target.path(), LinkOption.NOFOLLOW_LINKS)) {
            throw new SkillNotFoundException("target not found: " + relativePath);
        }
        if (isRootManifest(skillDir, target)) {
            throw new SkillValidationException("the root " + SkillManifest.FILE_NAME + " cannot be deleted");
        }
        try {
            if (Files.isDirectory(target.path(), LinkOption.NOFOLLOW_LINKS)) {
                FileSystemUtils.deleteRecursively(target.path());
            } else {
                Files.delete(target.path());
            }
        } catch (IOException ex) {
            throw new SkillStorageException("Cannot delete " + relativePath, ex);
        }
    }

    // ========= Paths =========

    /**
     * Resolves a caller supplied relative path inside {@code skillDir}.
     *
     * @throws SkillValidationException     if the path is empty and {@code allowRoot} is false
     * @throws SkillPathViolationException if the path contains {@code ..} or resolves outside the skill directory
     */
    public ResolvedPath resolvePath(Path skillDir, String relativePath, boolean allowRoot) {
        String rel = relativePath == null ? "" : relativePath.trim().replace('\\', '/');
        while (rel.startsWith("/")) {
            rel = rel.substring(1);
        }
        if (rel.isEmpty() && !allowRoot) {
            throw new SkillValidationException("path must not be empty");
        }
        for (String segment : rel.split("/")) {
            if ("..".equals(segment)) {
                throw new SkillPathViolationException("parent path references are not allowed: " + relativePath);
            }
        }

        try {
            Path root = SkillFiles.realPath(skillDir);
            Path target = rel.isEmpty() ? root : SkillFiles.realPath(root.resolve(rel));
            if (!target.startsWith(root)) {
                throw new SkillPathViolationException("path escapes the skill directory: " + relativePath);
            }
            if (!allowRoot && target.equals(root)) {
                throw new SkillValidationException("path must not address the skill directory itself: " + relativePath);
            }
            return new ResolvedPath(target, SkillFiles.toPosix(root.relativize(target)));
        } catch (IOException ex) {
            throw new SkillPathViolationException("cannot resolve path: " + relativePath);
        }
    }

    public Path skillDirectory(String slug) {
        if (!SkillSlugs.isValid(slug)) {
            throw new SkillValidationException("invalid skill slug: " + slug);
        }
        return skillsRoot.resolve(slug);
    }

    // ========= Internals =========

    private void writeText(SkillRecord record, Path skillDir, ResolvedPath target, String content, String updatedBy) {
        SkillManifest manifest = null;
        if (isRootManifest(skillDir, target)) {
            manifest = SkillManifestParser.parse(content);
            if (!manifest.name().equals(record.slug())) {
                throw new SkillValidationException(
                        SkillManifest.FILE_NAME + " frontmatter name must equal the skill slug: " + record.slug());
            }
        }

        String previous = null;
        try {
            if (manifest != null && Files.isRegularFile(target.path())) {
                previous = Files.readString(target.path(), StandardCharsets.UTF_8);
            }
            Files.createDirectories(target.path().getParent());
            Files.writeString(target.path(), content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new SkillStorageException("Cannot write " + target.relativePath(), ex);
        }
        if (manifest == null) {
            return;
        }

        try {
            repository.updateMetadata(record.slug(), manifest.name(), manifest.description(), updatedBy);
        } catch (RuntimeException ex) {
            restoreManifest(target.path(), previous, ex);
            throw ex;
        }
        rebuildCache();
    }

    private void restoreManifest(Path manifestFile, String previous, RuntimeException cause) {
        try {
            if (previous == null) {
                Files.deleteIfExists(manifestFile);
            } else {
                Files.writeString(manifestFile, previous, StandardCharsets.UTF_8);
            }
        } catch (IOException restoreEx) {
            log.error("Cannot restore {}", manifestFile, restoreEx);
            cause.addSuppressed(restoreEx);
        }
    }

    private boolean isRootManifest(Path skillDir, ResolvedPath target) {
        try {
            return target.path().equals(SkillFiles.realPath(skillDir).resolve(SkillManifest.FILE_NAME));
        } catch (IOException ex) {
            return false;
        }
    }

    private void extractArchive(Path zipPath, Path extractDir) throws IOException {
        try (ZipFile zipFile = new ZipFile(zipPath.toFile())) {
            List<? extends ZipEntry> entries = entriesOf(zipFile);
            int manifests = 0;
            for (ZipEntry entry : entries) {
                validateEntryName(entry.getName());
                if (!entry.isDirectory() && isManifestEntry(entry.getName())) {
                    manifests++;
                }
            }
            if (manifests != 1) {
                throw new SkillValidationException(
                        "archive must contain exactly one " + SkillManifest.FILE_NAME + ", found " + manifests);
            }

            Files.createDirectories(extractDir);
            for (ZipEntry entry : entries) {
                Path target = extractDir.resolve(entry.getName().replace('\\', '/')).normalize();
                if (!target.startsWith(extractDir)) {
                    throw new SkillPathViolationException("archive entry escapes extraction root: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                try (InputStream in = zipFile.getInputStream(entry)) {
                    Files.copy(in, target);
                }
            }
        } catch (ZipException ex) {
            throw new SkillValidationException("uploaded file is not a valid zip archive", ex);
        }
    }

    private List<? extends ZipEntry> entriesOf(ZipFile zipFile) {
        List<ZipEntry> entries = new ArrayList<>();
        Enumeration<? extends ZipEntry> enumeration = zipFile.entries();
        while (enumeration.hasMoreElements()) {
            entries.add(enumeration.nextElement());
        }
        return entries;
    }

    private void validateEntryName(String name) {
        String normalized = name.replace('\\', '/');
        if (normalized.startsWith("/") || normalized.matches("^[A-Za-z]:.*")) {
            throw new SkillPathViolationException("archive contains an absolute path: " + name);
        }
        for (String segment : normalized.split("/")) {
            if ("..".equals(segment)) {
                throw new SkillPathViolationException("archive contains a parent path reference: " + name);
            }
        }
    }

    private boolean isManifestEntry(String name) {
        String normalized = name.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return SkillManifest.FILE_NAME.equals(slash < 0 ? normalized : normalized.substring(slash + 1));
    }

    private Path locateSingleManifest(Path extractDir) throws IOException {
        try (Stream<Path> walk = Files.walk(extractDir)) {
            List<Path> manifests = walk
                    .filter(path -> Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS))
                    .filter(path -> SkillManifest.FILE_NAME.equals(path.getFileName().toString()))
                    .toList();
            if (manifests.size() != 1) {
                throw new SkillValidationException(
                        "archive must contain exactly one " + SkillManifest.FILE_NAME + ", found " + manifests.size());
            }
            return manifests.get(0);
        }
    }

    private Path publish(Path stageDir, String slug) throws IOException {
        Path tempTarget = skillsRoot.resolve("." + slug + ".tmp-" + shortId());
        Files.move(stageDir, tempTarget);

        Path finalDir = skillsRoot.resolve(slug);
        if (Files.exists(finalDir, LinkOption.NOFOLLOW_LINKS)) {
            SkillFiles.deleteQuietly(tempTarget);
            throw new SkillConflictException("skill directory conflict, please retry: " + slug);
        }
        try {
            Files.move(tempTarget, finalDir);
        } catch (FileAlreadyExistsException ex) {
            SkillFiles.deleteQuietly(tempTarget);
            throw new SkillConflictException("skill directory conflict, please retry: " + slug);
        } catch (IOException ex) {
            SkillFiles.deleteQuietly(tempTarget);
            throw ex;
        }
        return finalDir;
    }

    private List<SkillTreeNode> buildTree(Path dir, Path baseDir) throws IOException {
        List<Path> children;
        try (Stream<Path> stream = Files.list(dir)) {
            children = stream
                    .sorted(Comparator
                            .comparing((Path path) -> !Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS))
                            .thenComparing(path -> path.getFileName().toString().toLowerCase(Locale.ROOT)))
                    .toList();
        }
        List<SkillTreeNode> nodes = new ArrayList<>();
        for (Path child : children) {
            String name = child.getFileName().toString();
            String rel = SkillFiles.toPosix(baseDir.relativize(child));
            if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                nodes.add(SkillTreeNode.directory(name, rel, buildTree(child, baseDir)));
            } else {
                nodes.add(SkillTreeNode.file(name, rel));
            }
        }
        return nodes;
    }

    private Path resolveSkillDir(SkillRecord record) {
        String dirPath = StringUtils.hasText(record.dirPath()) ? record.dirPath() : "skills/" + record.slug();
        Path candidate = Path.of(dirPath);
        Path resolved = candidate.isAbsolute()
                ? candidate.normalize()
                : dataDir.resolve(candidate).normalize();
        if (!resolved.startsWith(skillsRoot) || resolved.equals(skillsRoot)) {
            throw new SkillPathViolationException("skill directory is outside the skills root: " + record.slug());
        }
        return resolved;
    }

    private Path existingSkillDir(SkillRecord record) {
        Path skillDir = resolveSkillDir(record);
        if (!Files.isDirectory(skillDir)) {
            throw new SkillNotFoundException("skill directory not found: " + record.dirPath());
        }
        return skillDir;
    }

    private boolean isFree(String slug) {
        return !repository.existsSlug(slug) && !Files.exists(skillsRoot.resolve(slug), LinkOption.NOFOLLOW_LINKS);
    }

    private void rebuildCache() {
        metadataCache.rebuild(repository.listAll());
    }

    private static String trimTrailingHyphens(String value) {
        String result = value;
        while (result.endsWith("-")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    public record ResolvedPath(Path path, String relativePath) {
    }
}
