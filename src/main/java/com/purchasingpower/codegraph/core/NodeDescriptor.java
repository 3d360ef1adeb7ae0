package com.purchasingpower.codegraph.core;

import java.util.Objects;

/**
 * Typed description of one end of a relation triple.
 *
 * <p>Identity is kind + qualified name + file path; line numbers are
 * attributes and take no part in equality.
 *
 * @since 1.0.0
 */
public record NodeDescriptor(
    NodeKind kind,
    String qualifiedName,
    String filePath,
    Integer lineStart,
    Integer lineEnd
) {

    public NodeDescriptor {
        Objects.requireNonNull(kind, "kind");
        if (qualifiedName == null || qualifiedName.isBlank()) {
            throw new IllegalArgumentException("Node qualified name is required");
        }
        filePath = filePath == null ? "" : filePath;
    }

    public static NodeDescriptor function(String qualifiedName, String filePath, Integer lineStart, Integer lineEnd) {
        return new NodeDescriptor(NodeKind.FUNCTION, qualifiedName, filePath, lineStart, lineEnd);
    }

    public static NodeDescriptor of(NodeKind kind, String qualifiedName) {
        return new NodeDescriptor(kind, qualifiedName, "", null, null);
    }

    public String identityKey() {
        return kind.getLabel() + "|" + qualifiedName + "|" + filePath;
    }

    /**
     * Last segment of the qualified name ("pkg.mod.run" -> "run", "bin/job.sh" -> "job.sh").
     */
    public String simpleName() {
        String name = qualifiedName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0 && slash < name.length() - 1) {
            name = name.substring(slash + 1);
        }
        if (kind == NodeKind.FUNCTION) {
            int dot = name.lastIndexOf('.');
            if (dot >= 0 && dot < name.length() - 1) {
                name = name.substring(dot + 1);
            }
        }
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeDescriptor other)) return false;
        return kind == other.kind
            && qualifiedName.equals(other.qualifiedName)
            && filePath.equals(other.filePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, qualifiedName, filePath);
    }
}
