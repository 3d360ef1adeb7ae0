package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ExecutorProperties {

    @Min(1)
    private int corePoolSize = 4;

    @Min(1)
    private int maxPoolSize = 8;

    @Min(0)
    private int queueCapacity = 100;
}
