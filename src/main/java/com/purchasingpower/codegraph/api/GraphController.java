package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.graph.GraphRetriever;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only code graph queries used during incident investigation.
 *
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1/graph")
@RequiredArgsConstructor
public class GraphController {

    private final GraphRetriever graphRetriever;

    /**
     * GET /api/v1/graph/related?tenant=claims&query=charge&limit=10
     */
    @GetMapping("/related")
    public ResponseEntity<RelatedContextResponse> related(@RequestParam String tenant,
                                                          @RequestParam String query,
                                                          @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(RelatedContextResponse.from(graphRetriever.findRelated(tenant, query, limit)));
    }

    /**
     * GET /api/v1/graph/callers?tenant=claims&function=charge
     */
    @GetMapping("/callers")
    public ResponseEntity<RelatedContextResponse> callers(@RequestParam String tenant,
                                                          @RequestParam String function,
                                                          @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(RelatedContextResponse.from(graphRetriever.callersOf(tenant, function, limit)));
    }

    /**
     * GET /api/v1/graph/callees?tenant=claims&function=run
     */
    @GetMapping("/callees")
    public ResponseEntity<RelatedContextResponse> callees(@RequestParam String tenant,
                                                          @RequestParam String function,
                                                          @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(RelatedContextResponse.from(graphRetriever.calleesOf(tenant, function, limit)));
    }
}
