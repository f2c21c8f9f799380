package com.casekeep.analysis.controller;

import com.casekeep.analysis.config.AnalysisProperties;
import com.casekeep.analysis.domain.AnalysisRunRequest;
import com.casekeep.analysis.domain.AnalysisRunView;
import com.casekeep.analysis.event.PipelineEventEncoder;
import com.casekeep.analysis.event.SseEmitterEventSink;
import com.casekeep.analysis.service.AnalysisOrchestratorService;
import com.casekeep.analysis.service.PreparedRun;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/v1/analysis")
public class AnalysisController {

    private final AnalysisOrchestratorService orchestratorService;
    private final PipelineEventEncoder eventEncoder;
    private final AsyncTaskExecutor pipelineTaskExecutor;
    private final AnalysisProperties properties;

    public AnalysisController(
        AnalysisOrchestratorService orchestratorService,
        PipelineEventEncoder eventEncoder,
        @Qualifier("pipelineTaskExecutor") AsyncTaskExecutor pipelineTaskExecutor,
        AnalysisProperties properties
    ) {
        this.orchestratorService = orchestratorService;
        this.eventEncoder = eventEncoder;
        this.pipelineTaskExecutor = pipelineTaskExecutor;
        this.properties = properties;
    }

    @PostMapping(value = "/pipeline", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter runPipeline(@Valid @RequestBody AnalysisRunRequest request) {
        PreparedRun prepared = orchestratorService.prepare(request);
        SseEmitter emitter = new SseEmitter(properties.getEmitterTimeout().toMillis());
        SseEmitterEventSink sink = new SseEmitterEventSink(emitter, eventEncoder);
        try {
            pipelineTaskExecutor.execute(() -> orchestratorService.execute(prepared, sink));
        } catch (TaskRejectedException ex) {
            orchestratorService.abandon(prepared, "Pipeline executor is saturated");
            throw ex;
        }
        return emitter;
    }

    @GetMapping("/runs/{runId}")
    public AnalysisRunView getRun(@PathVariable UUID runId) {
        return orchestratorService.getRun(runId)
            .orElseThrow(() -> new IllegalArgumentException("Analysis run not found: " + runId));
    }

    @GetMapping("/subjects/{subjectId}/runs/latest")
    public AnalysisRunView getLatestRun(@PathVariable String subjectId) {
        return orchestratorService.getLatestRun(subjectId)
            .orElseThrow(() -> new IllegalArgumentException("No analysis run for subject: " + subjectId));
    }
}
