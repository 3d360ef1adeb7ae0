package com.purchasingpower.codegraph.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Code Source Model Tests")
class CodeSourceTest {

    @Test
    @DisplayName("Should derive the same id for the same tenant, type and path")
    void testDeriveSourceId_IsStable() {
        String first = CodeSource.deriveSourceId("claims", SourceType.HOSTED_REPOSITORY, "org/svc");
        String second = CodeSource.deriveSourceId(" claims ", SourceType.HOSTED_REPOSITORY, " org/svc ");

        assertEquals("claims_hosted-repository_org_svc", first);
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Should derive different ids for different source types")
    void testDeriveSourceId_DependsOnType() {
        String hosted = CodeSource.deriveSourceId("claims", SourceType.HOSTED_REPOSITORY, "svc");
        String local = CodeSource.deriveSourceId("claims", SourceType.LOCAL_FILESYSTEM, "svc");

        assertThat(hosted).isNotEqualTo(local);
    }

    @Test
    @DisplayName("Should reject missing key fields")
    void testDeriveSourceId_RejectsBlankFields() {
        assertThatThrownBy(() -> CodeSource.deriveSourceId("", SourceType.HOSTED_REPOSITORY, "org/svc"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CodeSource.deriveSourceId("claims", null, "org/svc"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CodeSource.deriveSourceId("claims", SourceType.LOCAL_FILESYSTEM, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should default the branch to main")
    void testEffectiveBranch() {
        CodeSource source = CodeSource.builder().sourceId("s").build();
        assertEquals("main", source.getEffectiveBranch());
        assertThat(source.isNeverAnalyzed()).isTrue();

        source.setBranch("release/2.x");
        assertEquals("release/2.x", source.getEffectiveBranch());
    }

    @Test
    @DisplayName("Should accept wire names and legacy aliases for source types")
    void testSourceTypeAliases() {
        assertEquals(SourceType.HOSTED_REPOSITORY, SourceType.fromValue("hosted-repository"));
        assertEquals(SourceType.HOSTED_REPOSITORY, SourceType.fromValue("GitLab"));
        assertEquals(SourceType.LOCAL_FILESYSTEM, SourceType.fromValue("filesystem"));
        assertEquals(SourceType.LOCAL_FILESYSTEM, SourceType.fromValue("LOCAL_FILESYSTEM"));
        assertThatThrownBy(() -> SourceType.fromValue("svn")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Node identity should ignore line numbers")
    void testNodeDescriptorIdentity() {
        NodeDescriptor first = NodeDescriptor.function("billing.charge", "billing/charge.py", 4, 12);
        NodeDescriptor second = NodeDescriptor.function("billing.charge", "billing/charge.py", null, null);
        NodeDescriptor otherFile = NodeDescriptor.function("billing.charge", "legacy/charge.py", 4, 12);

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertThat(first).isNotEqualTo(otherFile);
        assertEquals("charge", first.simpleName());
        assertEquals("rebuild.sh", NodeDescriptor.of(NodeKind.SCRIPT, "scripts/rebuild.sh").simpleName());
    }

    @Test
    @DisplayName("Relation kinds are normalized and must be identifiers")
    void testRelationKind() {
        assertEquals(RelationKind.CALLS, RelationKind.of(" calls "));
        assertEquals("READS_TABLE", RelationKind.of("reads_table").name());
        assertThatThrownBy(() -> RelationKind.of("CALLS]->(x) DETACH DELETE x //"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
