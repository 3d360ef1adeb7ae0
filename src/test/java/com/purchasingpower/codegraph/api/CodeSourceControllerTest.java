package com.purchasingpower.codegraph.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codegraph.build.tool.AnalysisToolClient;
import com.purchasingpower.codegraph.core.NodeDescriptor;
import com.purchasingpower.codegraph.core.RelationKind;
import com.purchasingpower.codegraph.core.RelationTriple;
import com.purchasingpower.codegraph.graph.GraphPublisher;
import com.purchasingpower.codegraph.registry.SourceRegistry;
import com.purchasingpower.codegraph.revision.RevisionResolver;
import com.purchasingpower.codegraph.workspace.WorkingCopyProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Code Source Controller Tests")
class CodeSourceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private SourceRegistry sourceRegistry;

    @Autowired
    private GraphPublisher graphPublisher;

    @MockBean
    private RevisionResolver revisionResolver;

    @MockBean
    private WorkingCopyProvider workingCopyProvider;

    @MockBean
    private AnalysisToolClient toolClient;

    @Test
    @DisplayName("Should register a source and derive its id")
    void testRegister_ShouldReturnSource() throws Exception {
        mockMvc.perform(post("/api/v1/code-sources/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "tenant", "claims",
                                "sourceType", "gitlab",
                                "path", "org/claims-intake",
                                "languages", List.of("Python", "python", "java")))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sourceId").value("claims_hosted-repository_org_claims-intake"))
                .andExpect(jsonPath("$.sourceType").value("hosted-repository"))
                .andExpect(jsonPath("$.languages.length()").value(2))
                .andExpect(jsonPath("$.branch").value("main"))
                .andExpect(jsonPath("$.enabled").value(true));
    }

    @Test
    @DisplayName("Should reject a registration without languages")
    void testRegister_ShouldValidate() throws Exception {
        mockMvc.perform(post("/api/v1/code-sources/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "tenant", "claims",
                                "sourceType", "hosted-repository",
                                "path", "org/no-languages",
                                "languages", List.of()))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("languages: At least one language is required"));

        mockMvc.perform(post("/api/v1/code-sources/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tenant\": \"claims\", \"sourceType\": \"svn\", \"path\": \"x\", \"languages\": [\"python\"]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should list sources filtered by tenant and enabled flag")
    void testList_ShouldFilter() throws Exception {
        register("ops", "local-filesystem", "/srv/ops/runbooks");
        String disabled = register("ops", "hosted-repository", "ops/retired");
        mockMvc.perform(put("/api/v1/code-sources/{id}/enabled", disabled).param("value", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));

        mockMvc.perform(get("/api/v1/code-sources").param("tenant", "ops"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2));

        mockMvc.perform(get("/api/v1/code-sources").param("tenant", "ops").param("enabledOnly", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.sources[0].path").value("/srv/ops/runbooks"));

        mockMvc.perform(get("/api/v1/code-sources").param("sourceType", "filesystem"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sources[*].sourceType", everyItem(is("local-filesystem"))))
                .andExpect(jsonPath("$.sources[*].path", hasItem("/srv/ops/runbooks")));
    }

    @Test
    @DisplayName("Should return 404 for unknown sources")
    void testGet_ShouldReturnNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/code-sources/{id}", "claims_hosted-repository_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Source not found: claims_hosted-repository_missing"));

        mockMvc.perform(delete("/api/v1/code-sources/{id}", "claims_hosted-repository_missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Deleting a source should keep its graph until cleanup")
    void testDeleteAndCleanup_ShouldRemoveGraph() throws Exception {
        // Given: an analyzed source with a published graph
        String sourceId = register("claims", "hosted-repository", "org/settlement");
        graphPublisher.publish("claims", sourceId, List.of(new RelationTriple(
                NodeDescriptor.function("settlement.close", "settlement/close.py", 3, null),
                RelationKind.CALLS,
                NodeDescriptor.function("settlement.notify", "settlement/notify.py", 9, null))));
        sourceRegistry.updateRevision(sourceId, "abc123", LocalDateTime.now());

        // When: the graph is cleaned up while registered
        mockMvc.perform(delete("/api/v1/code-sources/{id}/graph", sourceId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenant").value("claims"))
                .andExpect(jsonPath("$.nodesDeleted").value(2))
                .andExpect(jsonPath("$.edgesDeleted").value(1))
                .andExpect(jsonPath("$.artifactsDeleted").value(0));

        // Then: the next trigger rebuilds from scratch
        assertThat(sourceRegistry.get(sourceId).getLastAnalyzedRevision()).isNull();
        mockMvc.perform(get("/api/v1/graph/related").param("tenant", "claims").param("query", "settlement"))
                .andExpect(jsonPath("$.status").value("no_results"));

        // Deleting the registry entry leaves published data to an explicit cleanup
        graphPublisher.publish("claims", sourceId, List.of(new RelationTriple(
                NodeDescriptor.function("settlement.close", "settlement/close.py", 3, null),
                RelationKind.CALLS,
                NodeDescriptor.function("settlement.notify", "settlement/notify.py", 9, null))));
        mockMvc.perform(delete("/api/v1/code-sources/{id}", sourceId))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/graph/related").param("tenant", "claims").param("query", "settlement"))
                .andExpect(jsonPath("$.status").value("results"));

        mockMvc.perform(delete("/api/v1/code-sources/{id}/graph", sourceId))
                .andExpect(status().isBadRequest());
        mockMvc.perform(delete("/api/v1/code-sources/{id}/graph", sourceId).param("tenant", "claims"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodesDeleted").value(2));
    }

    private String register(String tenant, String sourceType, String path) throws Exception {
        String body = mockMvc.perform(post("/api/v1/code-sources/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "tenant", tenant,
                                "sourceType", sourceType,
                                "path", path,
                                "languages", List.of("python")))))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("sourceId").asText();
    }
}
