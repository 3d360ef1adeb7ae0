package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.core.SourceType;
import com.purchasingpower.codegraph.registry.SourceRegistration;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Code source registration request.
 *
 * <pre>
 * {"tenant": "claims", "sourceType": "hosted-repository", "path": "org/svc", "languages": ["python"]}
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterSourceRequest {

    @NotBlank(message = "Tenant is required")
    private String tenant;

    @NotNull(message = "Source type is required")
    private SourceType sourceType;

    @NotBlank(message = "Path is required")
    private String path;

    @NotEmpty(message = "At least one language is required")
    private List<String> languages;

    private String name;
    private String branch;

    @Builder.Default
    private boolean enabled = true;

    public SourceRegistration toRegistration() {
        return SourceRegistration.builder()
                .tenant(tenant)
                .sourceType(sourceType)
                .path(path)
                .languages(languages)
                .name(name)
                .branch(branch)
                .enabled(enabled)
                .build();
    }
}
