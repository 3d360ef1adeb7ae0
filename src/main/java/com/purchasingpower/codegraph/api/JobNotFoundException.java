package com.purchasingpower.codegraph.api;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String jobId) {
        super("Analysis job not found: " + jobId);
    }
}
