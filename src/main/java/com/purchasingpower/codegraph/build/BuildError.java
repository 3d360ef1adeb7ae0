package com.purchasingpower.codegraph.build;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Why a database could not be built for one source and language.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildError {

    private String sourceId;
    private String language;
    private BuildErrorType type;
    private String message;

    public String describe() {
        return type + " [" + language + "]: " + message;
    }
}
