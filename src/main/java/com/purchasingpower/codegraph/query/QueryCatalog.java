package com.purchasingpower.codegraph.query;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.purchasingpower.codegraph.exception.QueryCatalogException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Extraction query catalog.
 *
 * Loads every {@code queries/catalog*.yaml} on the classpath. A new relation
 * kind is one .ql file plus one entry:
 *
 * <pre>
 * queries:
 *   - name: python-imports
 *     relationKind: IMPORTS
 *     languages: [python]
 *     query: queries/python/imports.ql
 *     subject: { kind: File, nameColumn: file, fileColumn: file }
 *     object:  { kind: Module, nameColumn: module }
 * </pre>
 */
@Slf4j
@Service
public class QueryCatalog {

    static final String DEFAULT_LOCATION = "classpath*:queries/catalog*.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final String location;
    private final Map<String, QueryDefinition> definitions = new ConcurrentHashMap<>();
    private final List<String> order = new ArrayList<>();

    public QueryCatalog() {
        this(DEFAULT_LOCATION);
    }

    public QueryCatalog(String location) {
        this.location = location;
    }

    @PostConstruct
    public void load() {
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(location);
        } catch (IOException e) {
            throw new QueryCatalogException("Cannot scan query catalog " + location, e);
        }

        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                CatalogFile file = yamlMapper.readValue(in, CatalogFile.class);
                file.getQueries().forEach(this::register);
                log.info("Loaded {} queries from {}", file.getQueries().size(), resource.getFilename());
            } catch (IOException | IllegalArgumentException e) {
                throw new QueryCatalogException("Invalid query catalog " + resource.getDescription() + ": " + e.getMessage(), e);
            }
        }

        if (definitions.isEmpty()) {
            log.warn("⚠️  Query catalog {} is empty, extraction will produce no triples", location);
        }
    }

    /**
     * Add a definition. Names are unique across all catalog files.
     */
    public synchronized void register(QueryDefinition definition) {
        validate(definition);
        if (definitions.putIfAbsent(definition.getName(), definition) != null) {
            throw new QueryCatalogException("Duplicate query name: " + definition.getName());
        }
        order.add(definition.getName());
    }

    /**
     * Definitions applicable to a language, in catalog order.
     */
    public synchronized List<QueryDefinition> forLanguage(String language) {
        return order.stream()
                .map(definitions::get)
                .filter(definition -> definition.appliesTo(language))
                .toList();
    }

    public synchronized List<QueryDefinition> all() {
        return order.stream().map(definitions::get).toList();
    }

    public Optional<QueryDefinition> get(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    private void validate(QueryDefinition definition) {
        String name = definition.getName();
        if (name == null || name.isBlank()) {
            throw new QueryCatalogException("Query entry without a name");
        }
        if (definition.getRelationKind() == null) {
            throw new QueryCatalogException("Query " + name + " has no relationKind");
        }
        if (definition.getLanguages() == null || definition.getLanguages().isEmpty()) {
            throw new QueryCatalogException("Query " + name + " applies to no language");
        }
        if (definition.getQuery() == null || !new ClassPathResource(definition.getQuery()).exists()) {
            throw new QueryCatalogException("Query " + name + " references a missing file: " + definition.getQuery());
        }
        validateMapping(name, "subject", definition.getSubject());
        validateMapping(name, "object", definition.getObject());
    }

    private void validateMapping(String name, String end, NodeMapping mapping) {
        if (mapping == null || mapping.getKind() == null || mapping.getNameColumn() == null) {
            throw new QueryCatalogException("Query " + name + " needs a " + end + " kind and nameColumn");
        }
    }

    @Data
    static class CatalogFile {
        private List<QueryDefinition> queries = new ArrayList<>();
    }
}
