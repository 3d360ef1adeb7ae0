package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ArtifactProperties {

    /**
     * Storage backend. Only "local" ships with the service.
     */
    @NotBlank
    private String backend = "local";

    @NotBlank
    private String baseDir = "data/codeql-databases";
}
