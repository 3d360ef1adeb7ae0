package com.purchasingpower.codegraph.query.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.codegraph.build.tool.AnalysisToolClient;
import com.purchasingpower.codegraph.configuration.AnalysisProperties;
import com.purchasingpower.codegraph.core.AnalysisArtifact;
import com.purchasingpower.codegraph.exception.AnalysisToolException;
import com.purchasingpower.codegraph.exception.QueryCatalogException;
import com.purchasingpower.codegraph.query.BqrsTupleMapper;
import com.purchasingpower.codegraph.query.ExtractionResult;
import com.purchasingpower.codegraph.query.QueryCatalog;
import com.purchasingpower.codegraph.query.QueryDefinition;
import com.purchasingpower.codegraph.query.QueryError;
import com.purchasingpower.codegraph.query.QueryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs every catalog query of a language, one tool invocation per query.
 *
 * <p>Query files ship on the classpath and are copied to
 * {@code app.analysis.codeql.query-cache-dir} before first use, together
 * with the {@code qlpack.yml} of their directory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogQueryExecutor implements QueryExecutor {

    private static final String QLPACK_FILE = "qlpack.yml";

    private final QueryCatalog catalog;
    private final AnalysisToolClient toolClient;
    private final BqrsTupleMapper tupleMapper;
    private final AnalysisProperties properties;

    private final Map<String, Path> materialized = new ConcurrentHashMap<>();

    @Override
    public ExtractionResult extract(AnalysisArtifact artifact, String language, Instant deadline) {
        List<QueryDefinition> queries = catalog.forLanguage(language);
        if (queries.isEmpty()) {
            log.warn("No extraction queries defined for language {}", language);
            return ExtractionResult.empty();
        }

        Path database = Paths.get(artifact.getLocation());
        Duration configuredTimeout = properties.getCodeql().getQueryTimeout();
        ExtractionResult.ExtractionResultBuilder result = ExtractionResult.builder();
        int queriesRun = 0;
        int skippedRows = 0;

        for (QueryDefinition query : queries) {
            Duration timeout = remaining(configuredTimeout, deadline);
            if (timeout.isZero()) {
                result.failure(new QueryError(query.getName(), query.getRelationKind(), "Deadline expired before query started"));
                continue;
            }

            long startTime = System.currentTimeMillis();
            queriesRun++;
            try {
                JsonNode decoded = toolClient.runQuery(database, materialize(query.getQuery()), timeout);
                BqrsTupleMapper.MappedRows rows = tupleMapper.map(decoded, query);
                result.triples(rows.triples());
                skippedRows += rows.skipped();

                log.info("Query {} produced {} triples in {}ms",
                        query.getName(), rows.triples().size(), System.currentTimeMillis() - startTime);

            } catch (AnalysisToolException | QueryCatalogException e) {
                log.error("❌ Query {} failed on {}: {}", query.getName(), artifact.getSourceId(), e.getMessage());
                result.failure(new QueryError(query.getName(), query.getRelationKind(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("❌ Query {} failed unexpectedly on {}", query.getName(), artifact.getSourceId(), e);
                result.failure(new QueryError(query.getName(), query.getRelationKind(),
                        e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }

        return result.queriesRun(queriesRun).skippedRows(skippedRows).build();
    }

    /**
     * Copy a classpath query to the cache directory, once per process.
     */
    Path materialize(String resource) {
        return materialized.computeIfAbsent(resource, this::copyToCache);
    }

    private Path copyToCache(String resource) {
        Path cacheDir = Paths.get(properties.getCodeql().getQueryCacheDir()).toAbsolutePath();
        Path target = cacheDir.resolve(resource);
        try {
            Files.createDirectories(target.getParent());
            copy(new ClassPathResource(resource), target);

            String parent = resource.contains("/") ? resource.substring(0, resource.lastIndexOf('/') + 1) : "";
            ClassPathResource pack = new ClassPathResource(parent + QLPACK_FILE);
            if (pack.exists()) {
                copy(pack, target.resolveSibling(QLPACK_FILE));
            }
            log.debug("Materialized query {} to {}", resource, target);
            return target;

        } catch (IOException e) {
            throw new QueryCatalogException("Cannot materialize query " + resource + ": " + e.getMessage(), e);
        }
    }

    private static void copy(ClassPathResource resource, Path target) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Duration remaining(Duration configured, Instant deadline) {
        if (deadline == null) {
            return configured;
        }
        Duration left = Duration.between(Instant.now(), deadline);
        if (left.isNegative() || left.isZero()) {
            return Duration.ZERO;
        }
        return left.compareTo(configured) < 0 ? left : configured;
    }
}
