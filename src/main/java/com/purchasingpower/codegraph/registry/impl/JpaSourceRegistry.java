package com.purchasingpower.codegraph.registry.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.core.CodeSource;
import com.purchasingpower.codegraph.core.SourceType;
import com.purchasingpower.codegraph.exception.SourceNotFoundException;
import com.purchasingpower.codegraph.model.CodeSourceEntity;
import com.purchasingpower.codegraph.registry.SourceRegistration;
import com.purchasingpower.codegraph.registry.SourceRegistry;
import com.purchasingpower.codegraph.repository.CodeSourceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import jakarta.annotation.PostConstruct;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Source registry backed by the CODE_SOURCES table.
 *
 * <p>Each mutation takes a per-source-id lock and runs its own transaction
 * inside it, so the transaction commits before the next writer of the same
 * id reads.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class JpaSourceRegistry implements SourceRegistry {

    private final CodeSourceRepository repository;
    private final TransactionTemplate transactionTemplate;

    private final ConcurrentHashMap<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    public JpaSourceRegistry(CodeSourceRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @PostConstruct
    public void open() {
        log.info("📒 Source registry opened: {} sources registered", repository.count());
    }

    @Override
    public String register(SourceRegistration registration) {
        Preconditions.checkNotNull(registration, "Registration cannot be null");
        Preconditions.checkArgument(registration.getLanguages() != null && !registration.getLanguages().isEmpty(),
                "At least one language is required");

        String sourceId = CodeSource.deriveSourceId(
                registration.getTenant(), registration.getSourceType(), registration.getPath());
        List<String> languages = normalizeLanguages(registration.getLanguages());

        withLock(sourceId, () -> transactionTemplate.execute(status -> {
            Optional<CodeSourceEntity> existing = repository.findById(sourceId);
            CodeSourceEntity entity = existing.orElseGet(() -> CodeSourceEntity.builder()
                    .sourceId(sourceId)
                    .build());

            if (existing.isPresent()) {
                if (!entity.getPath().equals(registration.getPath().trim())) {
                    throw new IllegalArgumentException("Path " + registration.getPath().trim()
                            + " maps to the id of already registered path " + entity.getPath() + ": " + sourceId);
                }
                log.warn("Source already registered, updating: {}", sourceId);
                if (!Set.copyOf(entity.getLanguages()).equals(Set.copyOf(languages))
                        || !effectiveBranch(entity.getBranch()).equals(effectiveBranch(registration.getBranch()))) {
                    // The published graph no longer covers what will be analyzed
                    log.info("Languages or branch of {} changed, clearing revision {}", sourceId, entity.getLastAnalyzedRevision());
                    entity.setLastAnalyzedRevision(null);
                    entity.setLastAnalyzedTime(null);
                }
            }

            entity.setTenant(registration.getTenant().trim());
            entity.setSourceType(registration.getSourceType());
            entity.setPath(registration.getPath().trim());
            entity.setLanguages(languages);
            entity.setName(registration.getName() != null && !registration.getName().isBlank()
                    ? registration.getName()
                    : registration.getPath().trim());
            entity.setBranch(registration.getBranch());
            entity.setEnabled(registration.isEnabled());

            return repository.save(entity);
        }));

        log.info("Registered code source {} (tenant: {}, type: {}, path: {})",
                sourceId, registration.getTenant(), registration.getSourceType().getWireName(), registration.getPath());
        return sourceId;
    }

    @Override
    public CodeSource get(String sourceId) {
        return find(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId));
    }

    @Override
    public Optional<CodeSource> find(String sourceId) {
        if (sourceId == null || sourceId.isBlank()) {
            return Optional.empty();
        }
        return repository.findById(sourceId).map(JpaSourceRegistry::toCodeSource);
    }

    @Override
    public List<CodeSource> list(String tenant, SourceType sourceType, boolean enabledOnly) {
        String tenantFilter = tenant != null && !tenant.isBlank() ? tenant : null;
        return repository.search(tenantFilter, sourceType, enabledOnly).stream()
                .map(JpaSourceRegistry::toCodeSource)
                .toList();
    }

    @Override
    public void updateRevision(String sourceId, String revision, LocalDateTime analyzedAt) {
        Preconditions.checkNotNull(revision, "Revision cannot be null");

        Integer updated = withLock(sourceId, () -> transactionTemplate.execute(status ->
                repository.updateRevision(sourceId, revision, analyzedAt != null ? analyzedAt : LocalDateTime.now())));

        if (updated == null || updated == 0) {
            throw new SourceNotFoundException(sourceId);
        }
        log.debug("Updated revision for source {} -> {}", sourceId, revision);
    }

    @Override
    public void clearRevision(String sourceId) {
        Integer updated = withLock(sourceId, () -> transactionTemplate.execute(status ->
                repository.clearRevision(sourceId, LocalDateTime.now())));

        if (updated == null || updated == 0) {
            throw new SourceNotFoundException(sourceId);
        }
        log.info("Cleared recorded revision of source {}", sourceId);
    }

    @Override
    public void setEnabled(String sourceId, boolean enabled) {
        Integer updated = withLock(sourceId, () -> transactionTemplate.execute(status ->
                repository.updateEnabled(sourceId, enabled, LocalDateTime.now())));

        if (updated == null || updated == 0) {
            throw new SourceNotFoundException(sourceId);
        }
        log.info("Source {} {}", sourceId, enabled ? "enabled" : "disabled");
    }

    @Override
    public void delete(String sourceId) {
        withLock(sourceId, () -> transactionTemplate.execute(status -> {
            if (!repository.existsById(sourceId)) {
                throw new SourceNotFoundException(sourceId);
            }
            repository.deleteById(sourceId);
            return null;
        }));
        log.info("Deleted code source {}", sourceId);
    }

    private <T> T withLock(String sourceId, Supplier<T> action) {
        ReentrantLock lock = writeLocks.computeIfAbsent(sourceId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static List<String> normalizeLanguages(List<String> languages) {
        LinkedHashSet<String> ordered = new LinkedHashSet<>();
        for (String language : languages) {
            if (language != null && !language.isBlank()) {
                ordered.add(language.trim().toLowerCase());
            }
        }
        Preconditions.checkArgument(!ordered.isEmpty(), "At least one language is required");
        return new ArrayList<>(ordered);
    }

    static CodeSource toCodeSource(CodeSourceEntity entity) {
        return CodeSource.builder()
                .sourceId(entity.getSourceId())
                .tenant(entity.getTenant())
                .sourceType(entity.getSourceType())
                .path(entity.getPath())
                .languages(new ArrayList<>(entity.getLanguages()))
                .name(entity.getName())
                .branch(entity.getBranch())
                .lastAnalyzedRevision(entity.getLastAnalyzedRevision())
                .lastAnalyzedTime(entity.getLastAnalyzedTime())
                .enabled(entity.isEnabled())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private static String effectiveBranch(String branch) {
        return branch != null && !branch.isBlank() ? branch.trim() : CodeSource.DEFAULT_BRANCH;
    }
}
