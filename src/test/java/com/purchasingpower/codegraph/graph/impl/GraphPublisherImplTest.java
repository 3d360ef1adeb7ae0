package com.purchasingpower.codegraph.graph.impl;

import com.purchasingpower.codegraph.core.NodeDescriptor;
import com.purchasingpower.codegraph.core.NodeKind;
import com.purchasingpower.codegraph.core.RelationKind;
import com.purchasingpower.codegraph.core.RelationTriple;
import com.purchasingpower.codegraph.exception.GraphStoreException;
import com.purchasingpower.codegraph.exception.PublishException;
import com.purchasingpower.codegraph.graph.CodeGraphStore;
import com.purchasingpower.codegraph.graph.GraphNeighbor;
import com.purchasingpower.codegraph.graph.GraphNode;
import com.purchasingpower.codegraph.graph.PublishResult;
import com.purchasingpower.codegraph.graph.RelationshipDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Graph Publisher Tests")
class GraphPublisherImplTest {

    private static final NodeDescriptor RUN = NodeDescriptor.function("billing.run", "billing/run.py", 10, 20);
    private static final NodeDescriptor CHARGE = NodeDescriptor.function("billing.charge", "billing/charge.py", 4, 9);
    private static final NodeDescriptor AUDIT = NodeDescriptor.function("billing.audit", "billing/audit.py", 1, 3);

    private InMemoryCodeGraphStore store;
    private GraphPublisherImpl publisher;

    @BeforeEach
    void setUp() {
        store = new InMemoryCodeGraphStore();
        publisher = new GraphPublisherImpl(store);
    }

    @Test
    @DisplayName("Should write one node per identity and one edge per distinct triple")
    void testPublish_DeduplicatesNodesAndEdges() {
        // Given: the same call seen twice, once without line numbers
        List<RelationTriple> triples = List.of(
                new RelationTriple(NodeDescriptor.function("billing.run", "billing/run.py", null, null), RelationKind.CALLS, CHARGE),
                new RelationTriple(RUN, RelationKind.CALLS, CHARGE),
                new RelationTriple(RUN, RelationKind.CALLS, AUDIT));

        // When
        PublishResult result = publisher.publish("claims", "svc", triples);

        // Then
        assertEquals(3, result.getNodesWritten());
        assertEquals(2, result.getEdgesWritten());

        GraphNode run = store.findNodes("claims", "billing.run", 10).get(0);
        assertEquals(Integer.valueOf(10), run.getLineStart());

        List<GraphNeighbor> callees = store.findNeighbors("claims", run.getId(), RelationKind.CALLS,
                RelationshipDirection.OUTGOING, 10);
        GraphNeighbor charge = callees.stream()
                .filter(neighbor -> neighbor.getNode().getName().equals("charge"))
                .findFirst()
                .orElseThrow();
        assertEquals(2, charge.getOccurrences());
    }

    @Test
    @DisplayName("Republishing a source should fully replace its previous subgraph")
    void testPublish_FullRebuild() {
        // Given
        publisher.publish("claims", "svc", List.of(
                new RelationTriple(RUN, RelationKind.CALLS, CHARGE),
                new RelationTriple(RUN, RelationKind.CALLS, AUDIT)));

        // When: the audit call was removed upstream
        PublishResult result = publisher.publish("claims", "svc", List.of(new RelationTriple(RUN, RelationKind.CALLS, CHARGE)));

        // Then
        assertEquals(3, result.getNodesDeleted());
        assertEquals(2, result.getEdgesDeleted());
        assertEquals(2, store.countNodes("claims", "svc"));
        assertEquals(1, store.countEdges("claims", "svc"));
        assertThat(store.findNodes("claims", "audit", 10)).isEmpty();
    }

    @Test
    @DisplayName("Publishing one source should leave other sources untouched")
    void testPublish_IsolatedPerSource() {
        // Given: two sources sharing a function name
        publisher.publish("claims", "svc-a", List.of(new RelationTriple(RUN, RelationKind.CALLS, CHARGE)));
        publisher.publish("claims", "svc-b", List.of(new RelationTriple(RUN, RelationKind.CALLS, AUDIT)));

        // When
        publisher.publish("claims", "svc-a", List.of());

        // Then
        assertEquals(0, store.countNodes("claims", "svc-a"));
        assertEquals(2, store.countNodes("claims", "svc-b"));
        assertEquals(1, store.countEdges("claims", "svc-b"));
    }

    @Test
    @DisplayName("Equal node identities in different sources should never collide")
    void testNodeIdsAreScopedBySource() {
        assertThat(GraphNode.nodeId("claims", "svc-a", RUN)).isNotEqualTo(GraphNode.nodeId("claims", "svc-b", RUN));
        assertThat(GraphNode.nodeId("claims", "svc-a", RUN)).isNotEqualTo(GraphNode.nodeId("legal", "svc-a", RUN));
        assertEquals(GraphNode.nodeId("claims", "svc-a", RUN),
                GraphNode.nodeId("claims", "svc-a", NodeDescriptor.function("billing.run", "billing/run.py", null, null)));
    }

    @Test
    @DisplayName("Should keep node kinds of subprocess targets")
    void testPublish_ScriptNodes() {
        NodeDescriptor script = NodeDescriptor.of(NodeKind.SCRIPT, "scripts/rebuild_ledger.sh");

        publisher.publish("claims", "svc", List.of(new RelationTriple(RUN, RelationKind.RUNS_SUBPROCESS, script)));

        GraphNode node = store.findNodes("claims", "rebuild_ledger", 10).get(0);
        assertEquals(NodeKind.SCRIPT, node.getKind());
        assertEquals("rebuild_ledger.sh", node.getName());
    }

    @Test
    @DisplayName("Should delete a source's subgraph")
    void testDeleteSource() {
        publisher.publish("claims", "svc", List.of(new RelationTriple(RUN, RelationKind.CALLS, CHARGE)));

        PublishResult deleted = publisher.deleteSource("claims", "svc");

        assertEquals(2, deleted.getNodesDeleted());
        assertEquals(1, deleted.getEdgesDeleted());
        assertEquals(0, store.countNodes("claims", "svc"));
    }

    @Test
    @DisplayName("A store failure should surface as PublishException")
    void testPublish_StoreFailure() {
        CodeGraphStore failing = mock(CodeGraphStore.class);
        when(failing.replaceSubgraph(anyString(), anyString(), any(), any()))
                .thenThrow(new GraphStoreException("connection refused"));
        GraphPublisherImpl failingPublisher = new GraphPublisherImpl(failing);

        assertThatThrownBy(() -> failingPublisher.publish("claims", "svc", List.of(new RelationTriple(RUN, RelationKind.CALLS, CHARGE))))
                .isInstanceOf(PublishException.class)
                .hasMessageContaining("connection refused");
    }
}
