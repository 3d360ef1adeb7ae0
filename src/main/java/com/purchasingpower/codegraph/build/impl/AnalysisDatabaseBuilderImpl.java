package com.purchasingpower.codegraph.build.impl;

import com.purchasingpower.codegraph.artifact.ArtifactStore;
import com.purchasingpower.codegraph.build.AnalysisDatabaseBuilder;
import com.purchasingpower.codegraph.build.BuildError;
import com.purchasingpower.codegraph.build.BuildErrorType;
import com.purchasingpower.codegraph.build.BuildResult;
import com.purchasingpower.codegraph.build.tool.AnalysisToolClient;
import com.purchasingpower.codegraph.configuration.AnalysisProperties;
import com.purchasingpower.codegraph.configuration.CodeQlProperties;
import com.purchasingpower.codegraph.core.AnalysisArtifact;
import com.purchasingpower.codegraph.core.CodeSource;
import com.purchasingpower.codegraph.exception.AnalysisToolException;
import com.purchasingpower.codegraph.exception.ArtifactStoreException;
import com.purchasingpower.codegraph.exception.RevisionUnavailableException;
import com.purchasingpower.codegraph.exception.WorkingCopyException;
import com.purchasingpower.codegraph.revision.RevisionResolver;
import com.purchasingpower.codegraph.workspace.WorkingCopyProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisDatabaseBuilderImpl implements AnalysisDatabaseBuilder {

    private final RevisionResolver revisionResolver;
    private final WorkingCopyProvider workingCopyProvider;
    private final AnalysisToolClient toolClient;
    private final ArtifactStore artifactStore;
    private final AnalysisProperties properties;

    @Override
    public BuildResult build(CodeSource source, String language) {
        String revision;
        try {
            revision = revisionResolver.currentRevision(source);
        } catch (RevisionUnavailableException e) {
            log.error("❌ Cannot resolve revision of {}: {}", source.getSourceId(), e.getMessage());
            return failure(source, language, BuildErrorType.REVISION_UNAVAILABLE, e.getMessage(), 0);
        }
        return build(source, language, revision, null);
    }

    @Override
    public BuildResult build(CodeSource source, String language, String revision, Instant deadline) {
        long startTime = System.currentTimeMillis();
        String lang = language.toLowerCase();
        CodeQlProperties codeql = properties.getCodeql();

        // STEP 1: Reuse the stored database when nothing changed
        if (revision.equals(source.getLastAnalyzedRevision())) {
            Optional<AnalysisArtifact> cached = artifactStore.find(source.getTenant(), source.getSourceId(), lang, revision);
            if (cached.isPresent()) {
                log.info("♻️  Revision unchanged, reusing database for {} [{}]", source.getSourceId(), lang);
                return BuildResult.cached(cached.get());
            }
        }

        // STEP 2: Reject languages the extractor pack does not know
        if (codeql.getLanguages().stream().noneMatch(lang::equalsIgnoreCase)) {
            return failure(source, lang, BuildErrorType.UNSUPPORTED_LANGUAGE,
                    "Language not supported by the analysis tool: " + lang, elapsed(startTime));
        }

        Duration timeout = effectiveTimeout(codeql.getBuildTimeout(), deadline);
        if (timeout.isZero()) {
            return failure(source, lang, BuildErrorType.BUILD_TIMEOUT,
                    "Deadline expired before the build started", elapsed(startTime));
        }

        // STEP 3: Working copy at the requested revision
        Path workingCopy;
        try {
            workingCopy = workingCopyProvider.materialize(source, revision);
        } catch (WorkingCopyException e) {
            return failure(source, lang, BuildErrorType.WORKING_COPY_UNAVAILABLE, e.getMessage(), elapsed(startTime));
        }

        // STEP 4: Run the tool once for this language and store the result
        Path target = artifactStore.stagingPath(source.getTenant(), source.getSourceId(), lang, revision);
        try {
            log.info("🔨 Building {} database for {} @ {}", lang, source.getSourceId(), revision);
            Path database = toolClient.createDatabase(workingCopy, lang, target, codeql.getBuildCommands().get(lang), timeout);
            AnalysisArtifact artifact = artifactStore.put(source.getTenant(), source.getSourceId(), lang, revision, database);

            long duration = elapsed(startTime);
            log.info("✅ Built {} database for {} in {}ms", lang, source.getSourceId(), duration);
            return BuildResult.built(artifact, duration);

        } catch (AnalysisToolException e) {
            log.error("❌ Build failed for {} [{}]: {}", source.getSourceId(), lang, e.getMessage());
            return failure(source, lang, classify(e), e.getMessage(), elapsed(startTime));
        } catch (ArtifactStoreException e) {
            log.error("❌ Could not store database for {} [{}]", source.getSourceId(), lang, e);
            return failure(source, lang, BuildErrorType.BUILD_CRASH, e.getMessage(), elapsed(startTime));
        }
    }

    static BuildErrorType classify(AnalysisToolException e) {
        return switch (e.getReason()) {
            case TOOL_MISSING -> BuildErrorType.TOOL_MISSING;
            case UNSUPPORTED_LANGUAGE -> BuildErrorType.UNSUPPORTED_LANGUAGE;
            case TIMEOUT, INTERRUPTED -> BuildErrorType.BUILD_TIMEOUT;
            case NON_ZERO_EXIT, MALFORMED_OUTPUT, IO_ERROR -> BuildErrorType.BUILD_CRASH;
        };
    }

    /**
     * Configured timeout, shortened to the deadline when one is given. Zero when the deadline has passed.
     */
    static Duration effectiveTimeout(Duration configured, Instant deadline) {
        if (deadline == null) {
            return configured;
        }
        Duration remaining = Duration.between(Instant.now(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            return Duration.ZERO;
        }
        return remaining.compareTo(configured) < 0 ? remaining : configured;
    }

    private BuildResult failure(CodeSource source, String language, BuildErrorType type, String message, long durationMs) {
        return BuildResult.failure(BuildError.builder()
                .sourceId(source.getSourceId())
                .language(language)
                .type(type)
                .message(message)
                .build(), durationMs);
    }

    private static long elapsed(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
}
