package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
public class CodeQlProperties {

    /**
     * CodeQL executable, either on PATH or an absolute path.
     */
    @NotBlank
    private String executable = "codeql";

    @NotNull
    private Duration buildTimeout = Duration.ofHours(1);

    @NotNull
    private Duration queryTimeout = Duration.ofMinutes(5);

    /**
     * Languages the installed extractor pack supports.
     */
    private List<String> languages = new ArrayList<>(List.of(
        "python", "java", "javascript", "go", "cpp", "csharp", "ruby"));

    /**
     * Optional build command per compiled language, passed as --command.
     */
    private Map<String, String> buildCommands = new HashMap<>();

    /**
     * Directory the classpath query files are materialized into.
     */
    @NotBlank
    private String queryCacheDir = "data/codeql-queries";
}
