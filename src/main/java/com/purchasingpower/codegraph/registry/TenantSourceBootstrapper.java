package com.purchasingpower.codegraph.registry;

import com.purchasingpower.codegraph.configuration.AnalysisProperties;
import com.purchasingpower.codegraph.configuration.TenantProperties;
import com.purchasingpower.codegraph.core.SourceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Registers the sources declared under {@code app.analysis.tenants} once the
 * application is up. Registration is idempotent, so restarts do not create
 * duplicates and keep the recorded revisions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TenantSourceBootstrapper {

    private final AnalysisProperties properties;
    private final SourceRegistry sourceRegistry;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        registerDeclaredSources();
    }

    /**
     * @return ids of the sources registered from configuration
     */
    public List<String> registerDeclaredSources() {
        List<String> registered = new ArrayList<>();

        for (Map.Entry<String, TenantProperties> entry : properties.getTenants().entrySet()) {
            String tenant = entry.getKey();
            TenantProperties tenantProperties = entry.getValue();

            if (!tenantProperties.isEnabled()) {
                log.info("Analysis disabled for tenant {}, skipping declared sources", tenant);
                continue;
            }

            for (TenantProperties.SourceDefinition definition : tenantProperties.getSources()) {
                try {
                    String sourceId = sourceRegistry.register(SourceRegistration.builder()
                            .tenant(tenant)
                            .sourceType(SourceType.fromValue(definition.getType()))
                            .path(definition.getPath())
                            .languages(definition.getLanguages())
                            .name(definition.getName())
                            .branch(definition.getBranch())
                            .enabled(definition.isEnabled())
                            .build());
                    registered.add(sourceId);
                } catch (IllegalArgumentException e) {
                    log.error("❌ Invalid source declaration for tenant {} ({}): {}",
                            tenant, definition.getPath(), e.getMessage());
                }
            }
        }

        if (!registered.isEmpty()) {
            log.info("Registered {} sources from configuration", registered.size());
        }
        return registered;
    }
}
