package com.purchasingpower.codegraph.orchestration;

import org.slf4j.MDC;

/**
 * MDC scope tagging log lines of one analysis unit with its job and source.
 */
public final class AnalysisLogContext implements AutoCloseable {

    public static final String MDC_JOB_ID = "jobId";
    public static final String MDC_SOURCE_ID = "sourceId";

    public AnalysisLogContext(String jobId, String sourceId) {
        MDC.put(MDC_JOB_ID, jobId);
        MDC.put(MDC_SOURCE_ID, sourceId);
    }

    @Override
    public void close() {
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_SOURCE_ID);
    }
}
