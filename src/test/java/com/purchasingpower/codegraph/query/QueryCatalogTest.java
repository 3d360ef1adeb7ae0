package com.purchasingpower.codegraph.query;

import com.purchasingpower.codegraph.core.NodeKind;
import com.purchasingpower.codegraph.core.RelationKind;
import com.purchasingpower.codegraph.exception.QueryCatalogException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Query Catalog Tests")
class QueryCatalogTest {

    @Test
    @DisplayName("Should load the shipped catalog in file order")
    void testLoadsShippedCatalog() {
        QueryCatalog catalog = new QueryCatalog();
        catalog.load();

        List<QueryDefinition> python = catalog.forLanguage("PYTHON");

        assertThat(python).extracting(QueryDefinition::getName)
                .containsExactly("python-call-graph", "python-subprocess-calls", "python-imports");
        assertThat(python).extracting(QueryDefinition::getRelationKind)
                .containsExactly(RelationKind.CALLS, RelationKind.RUNS_SUBPROCESS, RelationKind.IMPORTS);
        assertThat(catalog.forLanguage("java")).extracting(QueryDefinition::getName).containsExactly("java-call-graph");
        assertThat(catalog.forLanguage("go")).isEmpty();
    }

    @Test
    @DisplayName("Column mappings should be read from the catalog entry")
    void testMappingDetails() {
        QueryCatalog catalog = new QueryCatalog();
        catalog.load();

        QueryDefinition subprocess = catalog.get("python-subprocess-calls").orElseThrow();

        assertEquals(NodeKind.FUNCTION, subprocess.getSubject().getKind());
        assertEquals("caller_line", subprocess.getSubject().getStartLineColumn());
        assertEquals(NodeKind.SCRIPT, subprocess.getObject().getKind());
        assertEquals("script", subprocess.getObject().getNameColumn());
    }

    @Test
    @DisplayName("A new relation kind needs only a catalog entry and a query file")
    void testNewRelationKindFromCatalog() {
        QueryCatalog catalog = new QueryCatalog("classpath*:test-catalogs/extra.yaml");
        catalog.load();

        QueryDefinition reads = catalog.get("python-table-reads").orElseThrow();

        assertEquals(RelationKind.of("READS_TABLE"), reads.getRelationKind());
        assertEquals(1, catalog.all().size());
    }

    @Test
    @DisplayName("Should reject duplicate query names")
    void testDuplicateName() {
        QueryCatalog catalog = new QueryCatalog();
        catalog.load();
        QueryDefinition copy = catalog.get("python-call-graph").orElseThrow();

        assertThatThrownBy(() -> catalog.register(copy))
                .isInstanceOf(QueryCatalogException.class)
                .hasMessageContaining("python-call-graph");
    }

    @Test
    @DisplayName("Should reject an entry whose query file is missing")
    void testMissingQueryFile() {
        QueryCatalog catalog = new QueryCatalog("classpath*:test-catalogs/missing-query.yaml");

        assertThatThrownBy(catalog::load)
                .isInstanceOf(QueryCatalogException.class)
                .hasMessageContaining("ghost.ql");
    }

    @Test
    @DisplayName("Should reject a relation kind that is not an identifier")
    void testInvalidRelationKind() {
        QueryCatalog catalog = new QueryCatalog("classpath*:test-catalogs/bad-kind.yaml");

        assertThatThrownBy(catalog::load).isInstanceOf(QueryCatalogException.class);
    }

    @Test
    @DisplayName("Should reject an entry without a subject mapping")
    void testMissingMapping() {
        QueryCatalog catalog = new QueryCatalog();

        QueryDefinition definition = QueryDefinition.builder()
                .name("python-half")
                .relationKind(RelationKind.CALLS)
                .languages(List.of("python"))
                .query("queries/python/call_graph.ql")
                .object(NodeMapping.builder().kind(NodeKind.FUNCTION).nameColumn("callee").build())
                .build();

        assertThatThrownBy(() -> catalog.register(definition))
                .isInstanceOf(QueryCatalogException.class)
                .hasMessageContaining("subject");
        assertThat(catalog.all()).isEmpty();
    }
}
