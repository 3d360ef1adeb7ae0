package com.purchasingpower.codegraph.artifact.impl;

import com.purchasingpower.codegraph.core.AnalysisArtifact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Local File System Artifact Store Tests")
class LocalFileSystemArtifactStoreTest {

    @TempDir
    Path tempDir;

    private LocalFileSystemArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new LocalFileSystemArtifactStore(tempDir.resolve("store"));
    }

    @Test
    @DisplayName("Should store a database built in the staging path and find it by revision")
    void testPutFromStagingPath() throws Exception {
        // Given: a database built where the store asked for it
        Path staging = store.stagingPath("claims", "svc", "python", "rev1");
        Files.createDirectories(staging);
        Files.writeString(staging.resolve("codeql-database.yml"), "primaryLanguage: python\n");

        // When
        AnalysisArtifact artifact = store.put("claims", "svc", "python", "rev1", staging);

        // Then
        assertEquals("rev1", artifact.getRevision());
        assertEquals(staging.toString(), artifact.getLocation());
        assertTrue(Files.isRegularFile(Path.of(artifact.getLocation()).resolve("codeql-database.yml")));

        Optional<AnalysisArtifact> found = store.find("claims", "svc", "python", "rev1");
        assertThat(found).isPresent();
        assertEquals("claims", found.get().getTenant());
        assertThat(found.get().getBuiltAt()).isNotNull();
    }

    @Test
    @DisplayName("Should move a database built elsewhere into the store")
    void testPutMovesExternalDatabase() throws Exception {
        Path scratch = Files.createDirectories(tempDir.resolve("scratch").resolve("db"));
        Files.writeString(scratch.resolve("marker"), "x");

        AnalysisArtifact artifact = store.put("claims", "svc", "python", "rev1", scratch);

        assertTrue(Files.isRegularFile(Path.of(artifact.getLocation()).resolve("marker")));
        assertThat(Files.exists(scratch)).isFalse();
    }

    @Test
    @DisplayName("get() should return the latest stored revision")
    void testGetReturnsLatest() throws Exception {
        put("claims", "svc", "python", "rev1");
        put("claims", "svc", "python", "rev2");

        assertEquals("rev2", store.get("claims", "svc", "python").orElseThrow().getRevision());
        assertThat(store.get("claims", "svc", "java")).isEmpty();
    }

    @Test
    @DisplayName("Storing a new revision should delete the superseded ones of that language only")
    void testPutPrunesSupersededRevisions() throws Exception {
        // Given
        put("claims", "svc", "python", "rev1");
        put("claims", "svc", "java", "rev1");
        Files.createDirectories(store.stagingPath("claims", "svc", "python", "rev-interrupted"));

        // When
        put("claims", "svc", "python", "rev2");
        put("claims", "svc", "python", "rev3");

        // Then: one artifact per language, the older python revisions gone from disk
        assertThat(store.list("claims"))
                .extracting(AnalysisArtifact::getLanguage, AnalysisArtifact::getRevision)
                .containsExactly(tuple("java", "rev1"), tuple("python", "rev3"));
        assertThat(store.find("claims", "svc", "python", "rev1")).isEmpty();
        assertThat(store.find("claims", "svc", "python", "rev2")).isEmpty();
        assertThat(store.find("claims", "svc", "java", "rev1")).isPresent();

        Path pythonDir = tempDir.resolve("store").resolve("claims").resolve("svc").resolve("python");
        try (Stream<Path> children = Files.list(pythonDir)) {
            assertThat(children.map(path -> path.getFileName().toString()))
                    .containsExactlyInAnyOrder("rev3", LocalFileSystemArtifactStore.LATEST_FILE);
        }
    }

    @Test
    @DisplayName("A revision directory without a descriptor is an interrupted build")
    void testIncompleteBuildIsIgnored() throws Exception {
        Files.createDirectories(store.stagingPath("claims", "svc", "python", "rev9"));

        assertThat(store.find("claims", "svc", "python", "rev9")).isEmpty();
    }

    @Test
    @DisplayName("Should list per tenant and delete all artifacts of a source")
    void testListAndDelete() throws Exception {
        put("claims", "svc", "python", "rev1");
        put("claims", "svc", "java", "rev1");
        put("claims", "batch", "python", "rev7");
        put("legal", "contracts", "java", "rev3");

        assertEquals(3, store.list("claims").size());
        assertEquals(4, store.list(null).size());

        assertEquals(2, store.delete("claims", "svc"));

        assertThat(store.list("claims")).extracting(AnalysisArtifact::getSourceId).containsExactly("batch");
        assertThat(store.find("claims", "svc", "python", "rev1")).isEmpty();
        assertEquals(0, store.delete("claims", "svc"));
    }

    @Test
    @DisplayName("Should reject key segments that escape the store")
    void testRejectsPathTraversal() {
        assertThatThrownBy(() -> store.stagingPath("claims", "..", "python", "rev1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.find("claims", "svc", "python", "a/b"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void put(String tenant, String sourceId, String language, String revision) throws Exception {
        Path staging = Files.createDirectories(store.stagingPath(tenant, sourceId, language, revision));
        store.put(tenant, sourceId, language, revision, staging);
    }
}
