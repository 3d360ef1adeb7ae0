package com.purchasingpower.codegraph.orchestration.impl;

import com.purchasingpower.codegraph.build.AnalysisDatabaseBuilder;
import com.purchasingpower.codegraph.build.BuildResult;
import com.purchasingpower.codegraph.configuration.AnalysisProperties;
import com.purchasingpower.codegraph.configuration.TenantProperties;
import com.purchasingpower.codegraph.core.AnalysisArtifact;
import com.purchasingpower.codegraph.core.CodeSource;
import com.purchasingpower.codegraph.core.SourceType;
import com.purchasingpower.codegraph.graph.GraphPublisher;
import com.purchasingpower.codegraph.graph.PublishResult;
import com.purchasingpower.codegraph.orchestration.AnalysisJobTracker;
import com.purchasingpower.codegraph.orchestration.OutcomeStatus;
import com.purchasingpower.codegraph.orchestration.SourceLockRegistry;
import com.purchasingpower.codegraph.orchestration.SourceOutcome;
import com.purchasingpower.codegraph.orchestration.TriggerResponse;
import com.purchasingpower.codegraph.query.ExtractionResult;
import com.purchasingpower.codegraph.query.QueryExecutor;
import com.purchasingpower.codegraph.registry.SourceRegistration;
import com.purchasingpower.codegraph.registry.impl.JpaSourceRegistry;
import com.purchasingpower.codegraph.repository.CodeSourceRepository;
import com.purchasingpower.codegraph.revision.RevisionResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Orchestrator runs against the persistent registry, with the pipeline stages mocked.
 */
@DataJpaTest
@Import(JpaSourceRegistry.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("Analysis Orchestrator Registry Tests")
class AnalysisOrchestratorRegistryTest {

    @Autowired
    private JpaSourceRegistry registry;

    @Autowired
    private CodeSourceRepository repository;

    private final RevisionResolver revisionResolver = mock(RevisionResolver.class);
    private final AnalysisDatabaseBuilder databaseBuilder = mock(AnalysisDatabaseBuilder.class);
    private final QueryExecutor queryExecutor = mock(QueryExecutor.class);
    private final GraphPublisher graphPublisher = mock(GraphPublisher.class);

    private AnalysisOrchestratorImpl orchestrator;

    @BeforeEach
    void setUp() {
        repository.deleteAll();

        AnalysisProperties properties = new AnalysisProperties();
        properties.getTenants().put("claims", new TenantProperties());
        orchestrator = new AnalysisOrchestratorImpl(registry, revisionResolver, databaseBuilder, queryExecutor,
                graphPublisher, new AnalysisJobTracker(properties), new SourceLockRegistry(), properties,
                new SyncTaskExecutor());

        when(revisionResolver.currentRevision(any())).thenReturn("rev-1");
        when(databaseBuilder.build(any(), anyString(), anyString(), any())).thenAnswer(invocation -> {
            CodeSource source = invocation.getArgument(0);
            return BuildResult.built(AnalysisArtifact.builder()
                    .tenant(source.getTenant())
                    .sourceId(source.getSourceId())
                    .language(invocation.getArgument(1))
                    .revision(invocation.getArgument(2))
                    .location("/store")
                    .build(), 1);
        });
        when(queryExecutor.extract(any(), anyString(), any())).thenReturn(ExtractionResult.empty());
        when(graphPublisher.publish(anyString(), anyString(), anyList())).thenReturn(PublishResult.builder().build());
    }

    @Test
    @DisplayName("A language added at an analyzed commit should be built on the next trigger")
    void testAddedLanguageIsAnalyzed() {
        // Given: python analyzed at rev-1
        String sourceId = registry.register(registration("python"));
        registry.updateRevision(sourceId, "rev-1", LocalDateTime.now());

        // When: java is added without a new commit
        registry.register(registration("python", "java"));
        TriggerResponse response = orchestrator.trigger("claims", sourceId, false, null);

        // Then
        SourceOutcome outcome = orchestrator.getJob(response.getJobId()).orElseThrow().getOutcome(sourceId);
        assertEquals(OutcomeStatus.DONE, outcome.getStatus());
        verify(databaseBuilder).build(any(), eq("java"), eq("rev-1"), any());
        verify(graphPublisher).publish(eq("claims"), eq(sourceId), anyList());
        assertEquals("rev-1", registry.get(sourceId).getLastAnalyzedRevision());
    }

    @Test
    @DisplayName("Re-registering unchanged languages should still skip the analyzed commit")
    void testUnchangedRegistrationIsSkipped() {
        String sourceId = registry.register(registration("python"));
        registry.updateRevision(sourceId, "rev-1", LocalDateTime.now());

        registry.register(registration("Python"));
        TriggerResponse response = orchestrator.trigger("claims", sourceId, false, null);

        SourceOutcome outcome = orchestrator.getJob(response.getJobId()).orElseThrow().getOutcome(sourceId);
        assertEquals(OutcomeStatus.SKIPPED, outcome.getStatus());
        verify(databaseBuilder, never()).build(any(), anyString(), anyString(), any());
    }

    private static SourceRegistration registration(String... languages) {
        return SourceRegistration.builder()
                .tenant("claims")
                .sourceType(SourceType.HOSTED_REPOSITORY)
                .path("org/svc")
                .languages(new ArrayList<>(List.of(languages)))
                .build();
    }
}
