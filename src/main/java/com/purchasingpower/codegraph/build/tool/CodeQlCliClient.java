package com.purchasingpower.codegraph.build.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codegraph.configuration.AnalysisProperties;
import com.purchasingpower.codegraph.exception.AnalysisToolException;
import com.purchasingpower.codegraph.exception.AnalysisToolException.Reason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the CodeQL CLI as an external process.
 *
 * <p>Output is redirected to a log file next to the target so a hung process
 * can be killed on timeout without a blocked reader.
 */
@Slf4j
@Service
public class CodeQlCliClient implements AnalysisToolClient {

    private static final String UNKNOWN_LANGUAGE_MARKER = "Did not recognize the following languages";
    private static final int MAX_LOGGED_OUTPUT = 2000;

    private final AnalysisProperties properties;
    private final ObjectMapper objectMapper;

    public CodeQlCliClient(AnalysisProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Path createDatabase(Path sourceRoot, String language, Path databaseDir, String buildCommand, Duration timeout) {
        List<String> command = new ArrayList<>();
        command.add(executable());
        command.add("database");
        command.add("create");
        command.add(databaseDir.toString());
        command.add("--language=" + language);
        command.add("--source-root=" + sourceRoot);
        command.add("--overwrite");
        if (buildCommand != null && !buildCommand.isBlank()) {
            command.add("--command=" + buildCommand);
        }

        log.info("Creating CodeQL database: language={}, source={}, target={}", language, sourceRoot, databaseDir);

        try {
            Files.createDirectories(databaseDir.getParent());
        } catch (IOException e) {
            throw new AnalysisToolException(Reason.IO_ERROR, "Cannot create " + databaseDir.getParent(), null, e);
        }

        String output = run(command, sourceRoot, timeout, databaseDir.resolveSibling(databaseDir.getFileName() + ".log"));
        if (output.contains(UNKNOWN_LANGUAGE_MARKER)) {
            throw new AnalysisToolException(Reason.UNSUPPORTED_LANGUAGE,
                    "CodeQL does not support language " + language, output, null);
        }

        log.info("✅ CodeQL database created: {}", databaseDir);
        return databaseDir;
    }

    @Override
    public JsonNode runQuery(Path databaseDir, Path queryFile, Duration timeout) {
        long startTime = System.currentTimeMillis();
        Path workDir;
        try {
            workDir = Files.createTempDirectory("codeql-query-");
        } catch (IOException e) {
            throw new AnalysisToolException(Reason.IO_ERROR, "Cannot create query work directory", null, e);
        }

        try {
            Path bqrs = workDir.resolve("results.bqrs");
            Path json = workDir.resolve("results.json");

            run(List.of(executable(), "query", "run",
                    "--database=" + databaseDir,
                    "--output=" + bqrs,
                    queryFile.toString()), workDir, timeout, workDir.resolve("query.log"));

            Duration remaining = timeout.minusMillis(System.currentTimeMillis() - startTime);
            run(List.of(executable(), "bqrs", "decode",
                    "--format=json",
                    "--output=" + json,
                    bqrs.toString()), workDir, remaining.isNegative() ? Duration.ofSeconds(1) : remaining,
                    workDir.resolve("decode.log"));

            try {
                return objectMapper.readTree(json.toFile());
            } catch (IOException e) {
                throw new AnalysisToolException(Reason.MALFORMED_OUTPUT,
                        "Query result is not valid JSON: " + e.getMessage(), null, e);
            }
        } finally {
            deleteQuietly(workDir);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            Path logFile = Files.createTempFile("codeql-version-", ".log");
            try {
                String output = run(List.of(executable(), "version"), logFile.getParent(), Duration.ofSeconds(30), logFile);
                log.info("CodeQL version check: {}", output.lines().findFirst().orElse(""));
                return true;
            } finally {
                Files.deleteIfExists(logFile);
            }
        } catch (AnalysisToolException | IOException e) {
            log.warn("⚠️  CodeQL not available: {}", e.getMessage());
            return false;
        }
    }

    private String run(List<String> command, Path workDir, Duration timeout, Path logFile) {
        String label = String.join(" ", command.subList(0, Math.min(3, command.size())));
        log.debug("Running: {}", String.join(" ", command));

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(workDir.toFile());
            builder.redirectErrorStream(true); // Merge stderr into stdout
            builder.redirectOutput(logFile.toFile());
            process = builder.start();
        } catch (IOException e) {
            throw new AnalysisToolException(Reason.TOOL_MISSING,
                    "CodeQL executable not found or not runnable: " + executable(), null, e);
        }

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new AnalysisToolException(Reason.TIMEOUT,
                        label + " timed out after " + timeout.toSeconds() + "s", readLog(logFile), null);
            }

            String output = readLog(logFile);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.error("{} failed with exit code {}: {}", label, exitCode, abbreviate(output));
                Reason reason = output.contains(UNKNOWN_LANGUAGE_MARKER) ? Reason.UNSUPPORTED_LANGUAGE : Reason.NON_ZERO_EXIT;
                throw new AnalysisToolException(reason,
                        label + " failed with exit code " + exitCode, output, null);
            }
            log.debug("[CODEQL] {}", abbreviate(output));
            return output;

        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new AnalysisToolException(Reason.INTERRUPTED, label + " interrupted", null, e);
        }
    }

    private String readLog(Path logFile) {
        try {
            return Files.exists(logFile) ? Files.readString(logFile, StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            log.warn("Could not read tool output {}: {}", logFile, e.getMessage());
            return "";
        }
    }

    private String executable() {
        return properties.getCodeql().getExecutable();
    }

    private static String abbreviate(String output) {
        return output.length() > MAX_LOGGED_OUTPUT ? output.substring(output.length() - MAX_LOGGED_OUTPUT) : output;
    }

    private static void deleteQuietly(Path dir) {
        try {
            org.springframework.util.FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", dir, e.getMessage());
        }
    }
}
