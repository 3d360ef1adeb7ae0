package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.artifact.ArtifactStore;
import com.purchasingpower.codegraph.core.CodeSource;
import com.purchasingpower.codegraph.core.SourceType;
import com.purchasingpower.codegraph.graph.GraphPublisher;
import com.purchasingpower.codegraph.graph.PublishResult;
import com.purchasingpower.codegraph.registry.SourceRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for the code source registry.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/code-sources")
@RequiredArgsConstructor
public class CodeSourceController {

    private final SourceRegistry sourceRegistry;
    private final GraphPublisher graphPublisher;
    private final ArtifactStore artifactStore;

    /**
     * POST /api/v1/code-sources/register
     */
    @PostMapping("/register")
    public ResponseEntity<CodeSourceResponse> register(@Valid @RequestBody RegisterSourceRequest request) {
        String sourceId = sourceRegistry.register(request.toRegistration());
        return ResponseEntity.ok(CodeSourceResponse.from(sourceRegistry.get(sourceId)));
    }

    /**
     * GET /api/v1/code-sources?tenant=&sourceType=&enabledOnly=
     */
    @GetMapping
    public ResponseEntity<SourceListResponse> list(@RequestParam(required = false) String tenant,
                                                   @RequestParam(required = false) String sourceType,
                                                   @RequestParam(defaultValue = "false") boolean enabledOnly) {
        SourceType type = sourceType != null && !sourceType.isBlank() ? SourceType.fromValue(sourceType) : null;
        List<CodeSourceResponse> sources = sourceRegistry.list(tenant, type, enabledOnly).stream()
                .map(CodeSourceResponse::from)
                .toList();
        return ResponseEntity.ok(new SourceListResponse(sources.size(), sources));
    }

    /**
     * GET /api/v1/code-sources/{sourceId}
     */
    @GetMapping("/{sourceId}")
    public ResponseEntity<CodeSourceResponse> get(@PathVariable String sourceId) {
        return ResponseEntity.ok(CodeSourceResponse.from(sourceRegistry.get(sourceId)));
    }

    /**
     * PUT /api/v1/code-sources/{sourceId}/enabled?value=true|false
     */
    @PutMapping("/{sourceId}/enabled")
    public ResponseEntity<CodeSourceResponse> setEnabled(@PathVariable String sourceId, @RequestParam boolean value) {
        sourceRegistry.setEnabled(sourceId, value);
        return ResponseEntity.ok(CodeSourceResponse.from(sourceRegistry.get(sourceId)));
    }

    /**
     * Remove the registry entry. Graph data stays until
     * {@code DELETE /api/v1/code-sources/{sourceId}/graph}.
     */
    @DeleteMapping("/{sourceId}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String sourceId) {
        sourceRegistry.delete(sourceId);
        return ResponseEntity.ok(Map.of(
                "sourceId", sourceId,
                "message", "Code source deleted; published graph data is kept until explicitly removed"));
    }

    /**
     * Remove the published graph and stored databases of a source. The tenant
     * parameter is needed only once the registry entry is gone.
     *
     * DELETE /api/v1/code-sources/{sourceId}/graph
     */
    @DeleteMapping("/{sourceId}/graph")
    public ResponseEntity<GraphCleanupResponse> deleteGraph(@PathVariable String sourceId,
                                                            @RequestParam(required = false) String tenant) {
        Optional<CodeSource> registered = sourceRegistry.find(sourceId);
        String owner = registered.map(CodeSource::getTenant).orElse(tenant);
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("Tenant is required for unregistered source " + sourceId);
        }
        if (registered.isPresent() && tenant != null && !tenant.equals(owner)) {
            throw new IllegalArgumentException("Source " + sourceId + " does not belong to tenant " + tenant);
        }

        PublishResult deleted = graphPublisher.deleteSource(owner, sourceId);
        int artifacts = artifactStore.delete(owner, sourceId);
        registered.ifPresent(source -> sourceRegistry.clearRevision(sourceId));

        return ResponseEntity.ok(GraphCleanupResponse.builder()
                .sourceId(sourceId)
                .tenant(owner)
                .nodesDeleted(deleted.getNodesDeleted())
                .edgesDeleted(deleted.getEdgesDeleted())
                .artifactsDeleted(artifacts)
                .build());
    }
}
