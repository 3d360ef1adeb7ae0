package com.purchasingpower.codegraph.registry;

import com.purchasingpower.codegraph.core.CodeSource;
import com.purchasingpower.codegraph.core.SourceType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of code sources per tenant and their last analyzed revision.
 *
 * <p>All mutations are atomic per source id. The orchestrator is the only
 * writer of the revision fields.
 *
 * @since 1.0.0
 */
public interface SourceRegistry {

    /**
     * Register or update a source. Idempotent: the same (tenant, type, path)
     * always yields the same id and a single entry; non-key fields take the
     * latest values while the recorded revision is preserved.
     *
     * @param registration Source to register
     * @return Derived source id
     */
    String register(SourceRegistration registration);

    /**
     * @throws com.purchasingpower.codegraph.exception.SourceNotFoundException if absent
     */
    CodeSource get(String sourceId);

    Optional<CodeSource> find(String sourceId);

    /**
     * List sources. Null filters match everything.
     *
     * @param tenant Tenant filter
     * @param sourceType Source type filter
     * @param enabledOnly Only enabled sources
     */
    List<CodeSource> list(String tenant, SourceType sourceType, boolean enabledOnly);

    /**
     * Record that the graph for {@code revision} has been published.
     */
    void updateRevision(String sourceId, String revision, LocalDateTime analyzedAt);

    /**
     * Forget the recorded revision so the next run rebuilds and republishes.
     */
    void clearRevision(String sourceId);

    void setEnabled(String sourceId, boolean enabled);

    /**
     * Remove the registry entry. Published graph data is left in place.
     */
    void delete(String sourceId);
}
