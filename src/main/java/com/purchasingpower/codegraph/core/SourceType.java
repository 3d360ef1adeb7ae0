package com.purchasingpower.codegraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of code source. Decides how revisions are resolved and how the
 * working copy is materialized.
 *
 * @since 1.0.0
 */
public enum SourceType {

    /**
     * Repository on a hosting service (GitLab, GitHub, Bitbucket...).
     * Path is either a project path ("org/svc") or a full clone URL.
     */
    HOSTED_REPOSITORY("hosted-repository"),

    /**
     * Directory on the local filesystem, optionally a git working tree.
     */
    LOCAL_FILESYSTEM("local-filesystem");

    private final String wireName;

    SourceType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Accepts the wire name ("hosted-repository"), the enum name, and the
     * legacy aliases "gitlab" / "filesystem".
     */
    @JsonCreator
    public static SourceType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Source type is required");
        }
        String normalized = value.trim().toLowerCase();
        return switch (normalized) {
            case "hosted-repository", "hosted_repository", "gitlab", "github", "git" -> HOSTED_REPOSITORY;
            case "local-filesystem", "local_filesystem", "filesystem", "local" -> LOCAL_FILESYSTEM;
            default -> throw new IllegalArgumentException("Unknown source type: " + value);
        };
    }
}
