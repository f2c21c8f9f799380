package com.casekeep.analysis.event;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

public class SseEmitterEventSink implements PipelineEventSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(SseEmitterEventSink.class);

    private final SseEmitter emitter;
    private final PipelineEventEncoder encoder;
    private volatile boolean detached;

    public SseEmitterEventSink(SseEmitter emitter, PipelineEventEncoder encoder) {
        this.emitter = emitter;
        this.encoder = encoder;
        emitter.onCompletion(() -> detached = true);
        emitter.onTimeout(() -> detached = true);
        emitter.onError(ex -> detached = true);
    }

    @Override
    public void send(PipelineEvent event) {
        if (detached) {
            return;
        }
        try {
            emitter.send(SseEmitter.event().data(encoder.encode(event)));
        } catch (IOException | IllegalStateException ex) {
            detached = true;
            LOGGER.info("Event listener went away, continuing without it: {}", ex.getMessage());
        }
    }

    @Override
    public void close() {
        if (!detached) {
            detached = true;
            emitter.complete();
        }
    }
}
