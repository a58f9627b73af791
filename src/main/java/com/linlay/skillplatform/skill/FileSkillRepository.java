package com.linlay.skillplatform.skill;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class FileSkillRepository implements SkillRepository {

    private static final Logger log = LoggerFactory.getLogger(FileSkillRepository.class);

    private static final Comparator<SkillRecord> MOST_RECENT_FIRST = Comparator
            .comparingLong(SkillRecord::updatedAt).reversed()
            .thenComparing(Comparator.comparingLong(SkillRecord::id).reversed());

    private final ObjectMapper objectMapper;
    private final Path indexFile;
    private final Clock clock;

    private final Object lock = new Object();
    private Map<String, SkillRecord> bySlug;
    private long nextId;

    @Autowired
    public FileSkillRepository(ObjectMapper objectMapper, SkillCatalogProperties properties) {
        this(objectMapper, properties.resolveIndexFile(), Clock.systemUTC());
    }

    public FileSkillRepository(ObjectMapper objectMapper, Path indexFile, Clock clock) {
        this.objectMapper = objectMapper;
        this.indexFile = indexFile.toAbsolutePath().normalize();
        this.clock = clock;
    }

    @Override
    public List<SkillRecord> listAll() {
        synchronized (lock) {
            return loaded().values().stream().sorted(MOST_RECENT_FIRST).toList();
        }
    }

    @Override
    public Optional<SkillRecord> findBySlug(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            return Optional.ofNullable(loaded().get(slug));
        }
    }

    @Override
    public SkillRecord create(NewSkill skill) {
        synchronized (lock) {
            Map<String, SkillRecord> current = loaded();
            if (current.containsKey(skill.slug())) {
                throw new SkillConflictException("skill already exists: " + skill.slug());
            }
            long now = clock.millis();
            SkillDependencies dependencies = skill.dependencies() == null ? SkillDependencies.NONE : skill.dependencies();
            SkillRecord created = new SkillRecord(
                    nextId,
                    skill.slug(),
                    skill.name(),
                    skill.description(),
                    skill.dirPath(),
                    dependencies.toolNames(),
                    dependencies.integrationNames(),
                    dependencies.skills(),
                    skill.createdBy(),
                    skill.createdBy(),
                    now,
                    now
            );
            Map<String, SkillRecord> next = new LinkedHashMap<>(current);
            next.put(created.slug(), created);
            persist(next, nextId + 1);
            return created;
        }
    }

    @Override
    public SkillRecord updateMetadata(String slug, String name, String description, String updatedBy) {
        synchronized (lock) {
            SkillRecord existing = require(slug);
            return replace(existing.withMetadata(name, description, updatedBy, clock.millis()));
        }
    }

    @Override
    public SkillRecord updateDependencies(String slug, SkillDependencies dependencies, String updatedBy) {
        synchronized (lock) {
            SkillRecord existing = require(slug);
            return replace(existing.withDependencies(dependencies, updatedBy, clock.millis()));
        }
    }

    @Override
    public void delete(String slug) {
        synchronized (lock) {
            require(slug);
            Map<String, SkillRecord> next = new LinkedHashMap<>(loaded());
            next.remove(slug);
            persist(next, nextId);
        }
    }

    private SkillRecord require(String slug) {
        SkillRecord existing = loaded().get(slug);
        if (existing == null) {
            throw SkillNotFoundException.skill(slug);
        }
        return existing;
    }

    private SkillRecord replace(SkillRecord updated) {
        Map<String, SkillRecord> next = new LinkedHashMap<>(loaded());
        next.put(updated.slug(), updated);
        persist(next, nextId);
        return updated;
    }

    private Map<String, SkillRecord> loaded() {
        if (bySlug != null) {
            return bySlug;
        }
        Map<String, SkillRecord> records = new LinkedHashMap<>();
        long maxId = 0;
        if (Files.isRegularFile(indexFile)) {
            try {
                IndexFile index = objectMapper.readValue(indexFile.toFile(), IndexFile.class);
                if (index.skills() != null) {
                    for (SkillRecord record : index.skills()) {
                        records.put(record.slug(), record);
                        maxId = Math.max(maxId, record.id());
                    }
                }
                nextId = Math.max(index.nextId(), maxId + 1);
            } catch (IOException ex) {
                throw new SkillStorageException("Cannot read skill index " + indexFile, ex);
            }
        } else {
            nextId = 1;
        }
        bySlug = records;
        log.debug("Loaded skill index {}, size={}", indexFile, records.size());
        return bySlug;
    }

    private void persist(Map<String, SkillRecord> records, long newNextId) {
        IndexFile index = new IndexFile(newNextId, new ArrayList<>(records.values()));
        try {
            Files.createDirectories(indexFile.getParent());
            Path temp = Files.createTempFile(indexFile.getParent(), ".skills-", ".json.tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), index);
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException ex) {
            throw new SkillStorageException("Cannot write skill index " + indexFile, ex);
        }
        bySlug = records;
        nextId = newNextId;
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, indexFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, indexFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    record IndexFile(long nextId, List<SkillRecord> skills) {
    }
}
