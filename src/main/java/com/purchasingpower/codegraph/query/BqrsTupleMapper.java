package com.purchasingpower.codegraph.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.codegraph.core.NodeDescriptor;
import com.purchasingpower.codegraph.core.RelationTriple;
import com.purchasingpower.codegraph.exception.AnalysisToolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns decoded BQRS JSON into relation triples.
 *
 * <pre>
 * {"#select": {"columns": [{"name": "caller"}, ...],
 *              "tuples":  [[{"label": "pkg.run"}, "pkg/mod.py", 12, ...]]}}
 * </pre>
 *
 * Entity cells contribute their {@code label}; primitive cells are used as is.
 */
@Slf4j
@Component
public class BqrsTupleMapper {

    static final String RESULT_SET = "#select";

    /**
     * Rows that mapped to triples plus the number that did not.
     */
    public record MappedRows(List<RelationTriple> triples, int skipped) {
    }

    /**
     * @throws AnalysisToolException with {@code MALFORMED_OUTPUT} when the document has no result set
     */
    public MappedRows map(JsonNode result, QueryDefinition definition) {
        JsonNode resultSet = result == null ? null : result.get(RESULT_SET);
        if (resultSet == null || !resultSet.path("tuples").isArray()) {
            throw new AnalysisToolException(AnalysisToolException.Reason.MALFORMED_OUTPUT,
                    "Result of " + definition.getName() + " has no " + RESULT_SET + " tuples");
        }

        Map<String, Integer> columns = columnIndex(resultSet.path("columns"));
        List<RelationTriple> triples = new ArrayList<>();
        int skipped = 0;

        for (JsonNode tuple : resultSet.get("tuples")) {
            try {
                NodeDescriptor subject = node(tuple, columns, definition.getSubject());
                NodeDescriptor object = node(tuple, columns, definition.getObject());
                triples.add(new RelationTriple(subject, definition.getRelationKind(), object));
            } catch (IllegalArgumentException e) {
                skipped++;
                log.debug("Skipping row of {}: {}", definition.getName(), e.getMessage());
            }
        }

        if (skipped > 0) {
            log.warn("⚠️  {} rows of {} could not be mapped", skipped, definition.getName());
        }
        return new MappedRows(triples, skipped);
    }

    private NodeDescriptor node(JsonNode tuple, Map<String, Integer> columns, NodeMapping mapping) {
        String name = text(tuple, columns, mapping.getNameColumn());
        String file = mapping.getFileColumn() == null ? "" : text(tuple, columns, mapping.getFileColumn());
        return new NodeDescriptor(mapping.getKind(), name, file,
                line(tuple, columns, mapping.getStartLineColumn()),
                line(tuple, columns, mapping.getEndLineColumn()));
    }

    private String text(JsonNode tuple, Map<String, Integer> columns, String column) {
        JsonNode cell = cell(tuple, columns, column);
        if (cell == null || cell.isNull()) {
            return null;
        }
        JsonNode value = cell.isObject() ? cell.get("label") : cell;
        return value == null || value.isNull() ? null : value.asText();
    }

    private Integer line(JsonNode tuple, Map<String, Integer> columns, String column) {
        if (column == null) {
            return null;
        }
        String value = text(tuple, columns, column);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            int line = Integer.parseInt(value.trim());
            return line > 0 ? line : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private JsonNode cell(JsonNode tuple, Map<String, Integer> columns, String column) {
        Integer index = columns.get(column);
        if (index == null) {
            index = positional(column);
        }
        if (index == null) {
            throw new IllegalArgumentException("Unknown result column " + column);
        }
        return index < tuple.size() ? tuple.get(index) : null;
    }

    private static Integer positional(String column) {
        try {
            return Integer.valueOf(column);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Map<String, Integer> columnIndex(JsonNode columns) {
        Map<String, Integer> index = new HashMap<>();
        if (columns.isArray()) {
            for (int i = 0; i < columns.size(); i++) {
                JsonNode name = columns.get(i).get("name");
                if (name != null && !name.isNull()) {
                    index.put(name.asText(), i);
                }
            }
        }
        return index;
    }
}
