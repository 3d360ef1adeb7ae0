package com.purchasingpower.codegraph.configuration;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-tenant (business area) analysis settings and declared sources.
 */
@Data
public class TenantProperties {

    private boolean enabled = true;

    private List<SourceDefinition> sources = new ArrayList<>();

    @Data
    public static class SourceDefinition {
        private String type = "hosted-repository";
        private String path;
        private List<String> languages = new ArrayList<>();
        private String name;
        private String branch;
        private boolean enabled = true;
    }
}
