package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.orchestration.AnalysisOrchestrator;
import com.purchasingpower.codegraph.orchestration.TriggerResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * REST controller for triggering analysis and polling job status.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analyze")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisOrchestrator orchestrator;

    /**
     * Trigger analysis of one source or a whole tenant.
     *
     * POST /api/v1/analyze
     */
    @PostMapping
    public ResponseEntity<AnalyzeResponse> analyze(@Valid @RequestBody AnalyzeRequest request) {
        log.info("Analysis requested: tenant={}, source={}, force={}",
                request.getTenant(), request.getSourceId(), request.isForce());

        Duration timeout = request.getTimeoutSeconds() != null ? Duration.ofSeconds(request.getTimeoutSeconds()) : null;
        TriggerResponse trigger = orchestrator.trigger(request.getTenant(), request.getSourceId(), request.isForce(), timeout);

        HttpStatus status = trigger.getStatus() == TriggerResponse.Status.RUNNING ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(AnalyzeResponse.from(trigger));
    }

    /**
     * GET /api/v1/analyze/jobs/{jobId}
     */
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobStatusResponse> getJob(@PathVariable String jobId) {
        return orchestrator.getJob(jobId)
                .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }
}
