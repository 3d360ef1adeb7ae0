package com.purchasingpower.codegraph.artifact.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.purchasingpower.codegraph.artifact.ArtifactStore;
import com.purchasingpower.codegraph.configuration.AnalysisProperties;
import com.purchasingpower.codegraph.core.AnalysisArtifact;
import com.purchasingpower.codegraph.exception.ArtifactStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Artifact store on the local filesystem.
 *
 * <pre>
 * {base}/{tenant}/{sourceId}/{language}/{revision}/database/     built database
 * {base}/{tenant}/{sourceId}/{language}/{revision}/artifact.json descriptor
 * {base}/{tenant}/{sourceId}/{language}/LATEST                   latest revision
 * </pre>
 *
 * The descriptor is written last, so a revision directory without one is an
 * interrupted build and is ignored. Once LATEST moves, the other revisions of
 * that language are deleted; only the latest artifact is kept.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.analysis.artifacts.backend", havingValue = "local", matchIfMissing = true)
public class LocalFileSystemArtifactStore implements ArtifactStore {

    static final String DESCRIPTOR_FILE = "artifact.json";
    static final String LATEST_FILE = "LATEST";
    static final String DATABASE_DIR = "database";

    private final Path baseDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public LocalFileSystemArtifactStore(AnalysisProperties properties) {
        this(Paths.get(properties.getArtifacts().getBaseDir()));
    }

    public LocalFileSystemArtifactStore(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        log.info("Local artifact store at {}", this.baseDir);
    }

    @Override
    public Path stagingPath(String tenant, String sourceId, String language, String revision) {
        return revisionDir(tenant, sourceId, language, revision).resolve(DATABASE_DIR);
    }

    @Override
    public AnalysisArtifact put(String tenant, String sourceId, String language, String revision, Path databasePath) {
        checkArgument(databasePath != null && Files.isDirectory(databasePath),
                "Database directory does not exist: %s", databasePath);

        Path revisionDir = revisionDir(tenant, sourceId, language, revision);
        Path target = revisionDir.resolve(DATABASE_DIR);

        try {
            Files.createDirectories(revisionDir);
            if (!databasePath.toAbsolutePath().normalize().equals(target.normalize())) {
                FileSystemUtils.deleteRecursively(target);
                Files.move(databasePath, target);
            }

            AnalysisArtifact artifact = AnalysisArtifact.builder()
                    .tenant(tenant)
                    .sourceId(sourceId)
                    .language(language)
                    .revision(revision)
                    .location(target.toString())
                    .builtAt(Instant.now())
                    .build();

            writeAtomically(revisionDir.resolve(DESCRIPTOR_FILE), objectMapper.writeValueAsString(artifact));
            writeAtomically(languageDir(tenant, sourceId, language).resolve(LATEST_FILE), revision);

            log.info("📦 Stored artifact {}/{}/{}@{}", tenant, sourceId, language, shortRevision(revision));
            pruneSuperseded(languageDir(tenant, sourceId, language), revisionDir);
            return artifact;

        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to store artifact for " + sourceId + "/" + language, e);
        }
    }

    @Override
    public Optional<AnalysisArtifact> get(String tenant, String sourceId, String language) {
        Path latestFile = languageDir(tenant, sourceId, language).resolve(LATEST_FILE);
        if (!Files.isRegularFile(latestFile)) {
            return Optional.empty();
        }
        try {
            String revision = Files.readString(latestFile, StandardCharsets.UTF_8).trim();
            return find(tenant, sourceId, language, revision);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read " + latestFile, e);
        }
    }

    @Override
    public Optional<AnalysisArtifact> find(String tenant, String sourceId, String language, String revision) {
        Path revisionDir = revisionDir(tenant, sourceId, language, revision);
        Path descriptor = revisionDir.resolve(DESCRIPTOR_FILE);
        if (!Files.isRegularFile(descriptor) || !Files.isDirectory(revisionDir.resolve(DATABASE_DIR))) {
            return Optional.empty();
        }
        return Optional.of(readDescriptor(descriptor));
    }

    @Override
    public List<AnalysisArtifact> list(String tenant) {
        Path root = tenant == null ? baseDir : baseDir.resolve(safeSegment(tenant));
        if (!Files.isDirectory(root)) {
            return List.of();
        }

        List<AnalysisArtifact> artifacts = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(root, tenant == null ? 5 : 4)) {
            paths.filter(path -> path.getFileName().toString().equals(DESCRIPTOR_FILE))
                    .sorted()
                    .forEach(descriptor -> artifacts.add(readDescriptor(descriptor)));
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to list artifacts under " + root, e);
        }
        artifacts.sort(Comparator.comparing(AnalysisArtifact::getSourceId)
                .thenComparing(AnalysisArtifact::getLanguage)
                .thenComparing(AnalysisArtifact::getBuiltAt));
        return artifacts;
    }

    @Override
    public int delete(String tenant, String sourceId) {
        Path sourceDir = baseDir.resolve(safeSegment(tenant)).resolve(safeSegment(sourceId));
        if (!Files.isDirectory(sourceDir)) {
            return 0;
        }
        int count = (int) list(tenant).stream()
                .filter(artifact -> sourceId.equals(artifact.getSourceId()))
                .count();
        try {
            FileSystemUtils.deleteRecursively(sourceDir);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to delete artifacts of " + sourceId, e);
        }
        log.info("🗑️  Deleted {} artifacts of {}", count, sourceId);
        return count;
    }

    /**
     * Deletes every revision directory of the language except the one LATEST now names.
     * The new artifact is already committed, so a failure here is logged, not thrown.
     */
    private void pruneSuperseded(Path languageDir, Path keep) {
        List<Path> superseded;
        try (Stream<Path> children = Files.list(languageDir)) {
            superseded = children.filter(Files::isDirectory)
                    .filter(dir -> !dir.equals(keep))
                    .toList();
        } catch (IOException e) {
            log.warn("⚠️  Could not list old revisions under {}: {}", languageDir, e.getMessage(), e);
            return;
        }
        for (Path dir : superseded) {
            try {
                FileSystemUtils.deleteRecursively(dir);
                log.debug("Pruned superseded revision {}", dir);
            } catch (IOException e) {
                log.warn("⚠️  Could not prune superseded revision {}: {}", dir, e.getMessage(), e);
            }
        }
    }

    private AnalysisArtifact readDescriptor(Path descriptor) {
        try {
            return objectMapper.readValue(descriptor.toFile(), AnalysisArtifact.class);
        } catch (IOException e) {
            throw new ArtifactStoreException("Corrupt artifact descriptor " + descriptor, e);
        }
    }

    private void writeAtomically(Path target, String content) throws IOException {
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        Files.writeString(temp, content, StandardCharsets.UTF_8);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path languageDir(String tenant, String sourceId, String language) {
        return baseDir.resolve(safeSegment(tenant))
                .resolve(safeSegment(sourceId))
                .resolve(safeSegment(language));
    }

    private Path revisionDir(String tenant, String sourceId, String language, String revision) {
        return languageDir(tenant, sourceId, language).resolve(safeSegment(revision));
    }

    private static String safeSegment(String segment) {
        checkArgument(segment != null && !segment.isBlank(), "Artifact key segment is required");
        checkArgument(!segment.contains("/") && !segment.contains("\\") && !segment.equals("..") && !segment.equals("."),
                "Invalid artifact key segment: %s", segment);
        return segment;
    }

    private static String shortRevision(String revision) {
        return revision.length() > 12 ? revision.substring(0, 12) : revision;
    }
}
