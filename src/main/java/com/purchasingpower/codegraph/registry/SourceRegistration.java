package com.purchasingpower.codegraph.registry;

import com.purchasingpower.codegraph.core.SourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Input of {@link SourceRegistry#register}. The source id is derived from
 * tenant, source type and path.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceRegistration {

    private String tenant;
    private SourceType sourceType;
    private String path;

    @Builder.Default
    private List<String> languages = new ArrayList<>();

    private String name;
    private String branch;

    @Builder.Default
    private boolean enabled = true;
}
