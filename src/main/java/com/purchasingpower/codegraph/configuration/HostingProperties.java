package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Where hosted-repository project paths are cloned from.
 */
@Data
public class HostingProperties {

    @NotBlank
    private String baseUrl = "https://gitlab.com";

    private String username;

    private String token;

    public boolean hasCredentials() {
        return token != null && !token.isBlank();
    }
}
