package com.purchasingpower.codegraph.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codegraph.build.tool.AnalysisToolClient;
import com.purchasingpower.codegraph.core.CodeSource;
import com.purchasingpower.codegraph.registry.SourceRegistry;
import com.purchasingpower.codegraph.revision.RevisionResolver;
import com.purchasingpower.codegraph.workspace.WorkingCopyProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Drives a full analysis through the REST API with the analysis tool and git
 * access mocked out.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Analysis Controller Tests")
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private SourceRegistry sourceRegistry;

    @MockBean
    private RevisionResolver revisionResolver;

    @MockBean
    private WorkingCopyProvider workingCopyProvider;

    @MockBean
    private AnalysisToolClient toolClient;

    private String revision;

    @BeforeEach
    void setUp() throws Exception {
        revision = UUID.randomUUID().toString().replace("-", "");
        JsonNode empty = objectMapper.readTree("{\"#select\": {\"columns\": [], \"tuples\": []}}");
        JsonNode callGraph = fixture("bqrs/call_graph.json");

        when(revisionResolver.currentRevision(any())).thenReturn(revision);
        when(workingCopyProvider.materialize(any(), anyString())).thenReturn(Path.of("target/test-data/working-copy"));
        when(toolClient.createDatabase(any(), anyString(), any(), any(), any())).thenAnswer(invocation -> {
            Path databaseDir = invocation.getArgument(2);
            Files.createDirectories(databaseDir);
            return databaseDir;
        });
        when(toolClient.runQuery(any(), any(), any())).thenReturn(empty);
        when(toolClient.runQuery(any(), argThat(query -> query != null && query.endsWith("call_graph.ql")), any()))
                .thenReturn(callGraph);
    }

    @Test
    @DisplayName("Should analyze a registered source and expose its call graph")
    void testAnalyze_ShouldPublishGraph() throws Exception {
        // Given
        String sourceId = register("org/billing-e2e");

        // When
        MvcResult triggered = mockMvc.perform(post("/api/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("tenant", "claims", "sourceId", sourceId))))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.sourceIds[0]").value(sourceId))
                .andReturn();
        String jobId = objectMapper.readTree(triggered.getResponse().getContentAsString()).get("jobId").asText();

        // Then
        JsonNode job = awaitJob(jobId);
        assertEquals("done", job.get("status").asText());
        JsonNode outcome = job.get("outcomes").get(0);
        assertEquals("done", outcome.get("status").asText());
        assertEquals(revision, outcome.get("revision").asText());
        assertEquals(3, outcome.get("triplesExtracted").asInt());

        CodeSource analyzed = sourceRegistry.get(sourceId);
        assertEquals(revision, analyzed.getLastAnalyzedRevision());
        assertThat(analyzed.getLastAnalyzedTime()).isNotNull();

        mockMvc.perform(get("/api/v1/graph/related")
                        .param("tenant", "claims")
                        .param("query", "ledger.post"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("results"))
                .andExpect(jsonPath("$.fragments[0].qualifiedName").value("billing.ledger.post"))
                .andExpect(jsonPath("$.fragments[*].qualifiedName", hasItem("billing.charge")));

        mockMvc.perform(get("/api/v1/graph/callers")
                        .param("tenant", "claims")
                        .param("function", "billing.ledger.post"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fragments[*].qualifiedName", hasItem("billing.charge")));

        // Same revision again: nothing to do
        MvcResult rerun = mockMvc.perform(post("/api/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("tenant", "claims", "sourceId", sourceId))))
                .andExpect(status().isAccepted())
                .andReturn();
        JsonNode skipped = awaitJob(objectMapper.readTree(rerun.getResponse().getContentAsString()).get("jobId").asText());
        assertEquals("skipped", skipped.get("outcomes").get(0).get("status").asText());
        assertEquals("revision_unchanged", skipped.get("outcomes").get(0).get("reason").asText());
    }

    @Test
    @DisplayName("Should report a failed build with its stage")
    void testAnalyze_ShouldReportBuildFailure() throws Exception {
        // Given
        String sourceId = register("org/billing-unsupported", "cobol");

        // When
        MvcResult triggered = mockMvc.perform(post("/api/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("tenant", "claims", "sourceId", sourceId))))
                .andExpect(status().isAccepted())
                .andReturn();

        // Then
        JsonNode job = awaitJob(objectMapper.readTree(triggered.getResponse().getContentAsString()).get("jobId").asText());
        assertEquals("failed", job.get("status").asText());
        JsonNode outcome = job.get("outcomes").get(0);
        assertEquals("BUILD", outcome.get("failureStage").asText());
        assertThat(outcome.get("reason").asText()).contains("UNSUPPORTED_LANGUAGE");
        assertThat(sourceRegistry.get(sourceId).getLastAnalyzedRevision()).isNull();
    }

    @Test
    @DisplayName("Should reject a tenant that is not enabled")
    void testAnalyze_ShouldRejectDisabledTenant() throws Exception {
        mockMvc.perform(post("/api/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("tenant", "legal"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("rejected"))
                .andExpect(jsonPath("$.jobId").doesNotExist());
    }

    @Test
    @DisplayName("Should require a tenant")
    void testAnalyze_ShouldValidateRequest() throws Exception {
        mockMvc.perform(post("/api/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceId\": \"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("tenant: Tenant is required"));
    }

    @Test
    @DisplayName("Should return 404 for an unknown job")
    void testGetJob_ShouldReturnNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/analyze/jobs/{jobId}", "no-such-job"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    private String register(String path, String... languages) throws Exception {
        List<String> requested = languages.length > 0 ? List.of(languages) : List.of("python");
        MvcResult result = mockMvc.perform(post("/api/v1/code-sources/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "tenant", "claims",
                                "sourceType", "hosted-repository",
                                "path", path,
                                "languages", requested))))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("sourceId").asText();
    }

    private JsonNode awaitJob(String jobId) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        while (true) {
            MvcResult result = mockMvc.perform(get("/api/v1/analyze/jobs/{jobId}", jobId))
                    .andExpect(status().isOk())
                    .andReturn();
            JsonNode job = objectMapper.readTree(result.getResponse().getContentAsString());
            if (!"running".equals(job.get("status").asText()) || System.currentTimeMillis() > deadline) {
                return job;
            }
            Thread.sleep(50);
        }
    }

    private JsonNode fixture(String path) throws Exception {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return objectMapper.readTree(in);
        }
    }
}
