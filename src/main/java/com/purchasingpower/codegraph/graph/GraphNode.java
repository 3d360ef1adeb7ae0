package com.purchasingpower.codegraph.graph;

import com.google.common.hash.Hashing;
import com.purchasingpower.codegraph.core.NodeDescriptor;
import com.purchasingpower.codegraph.core.NodeKind;
import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * A node as persisted in the graph store, tagged with its provenance.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class GraphNode {

    String id;
    NodeKind kind;
    String qualifiedName;
    String name;
    String filePath;
    Integer lineStart;
    Integer lineEnd;
    String tenant;
    String sourceId;

    public static GraphNode from(String tenant, String sourceId, NodeDescriptor descriptor) {
        return GraphNode.builder()
                .id(nodeId(tenant, sourceId, descriptor))
                .kind(descriptor.kind())
                .qualifiedName(descriptor.qualifiedName())
                .name(descriptor.simpleName())
                .filePath(descriptor.filePath())
                .lineStart(descriptor.lineStart())
                .lineEnd(descriptor.lineEnd())
                .tenant(tenant)
                .sourceId(sourceId)
                .build();
    }

    /**
     * Stable id: the same node of the same source always maps to the same id,
     * while equal names in two sources never collide.
     */
    public static String nodeId(String tenant, String sourceId, NodeDescriptor descriptor) {
        String key = tenant + "|" + sourceId + "|" + descriptor.identityKey();
        return Hashing.sha256().hashString(key, StandardCharsets.UTF_8).toString().substring(0, 32);
    }

    /**
     * Property map for the graph store. Absent line numbers are left out.
     */
    public Map<String, Object> toProperties() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("id", id);
        properties.put("kind", kind.getLabel());
        properties.put("qualifiedName", qualifiedName);
        properties.put("name", name);
        properties.put("filePath", filePath == null ? "" : filePath);
        properties.put("tenant", tenant);
        properties.put("sourceId", sourceId);
        if (lineStart != null) {
            properties.put("lineStart", lineStart);
        }
        if (lineEnd != null) {
            properties.put("lineEnd", lineEnd);
        }
        return properties;
    }
}
