package com.casekeep.analysis.client;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

public class PipelineStreamConsumer {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineStreamConsumer.class);

    static final String INCOMPLETE_STREAM_MESSAGE = "Analysis stream ended before completion";

    private final PipelineEventParser parser;

    public PipelineStreamConsumer() {
        this(new PipelineEventParser());
    }

    public PipelineStreamConsumer(PipelineEventParser parser) {
        this.parser = parser;
    }

    /**
     * Events in arrival order. The returned flux completes right after the first terminal event,
     * cancelling {@code body}.
     */
    public Flux<PipelineEvent> events(Flux<byte[]> body) {
        return Flux.defer(() -> {
            SseFrameDecoder decoder = new SseFrameDecoder();
            return body
                .flatMapIterable(decoder::decode)
                .map(parser::parse)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .takeUntil(PipelineEvent::isTerminal);
        });
    }

    public PipelineSubscription consume(Flux<byte[]> body, PipelineStreamListener listener) {
        PipelineSubscription subscription = new PipelineSubscription();
        AtomicBoolean finished = new AtomicBoolean();
        Disposable disposable = events(body).subscribe(
            event -> subscription.deliver(() -> dispatch(event, listener, finished)),
            error -> {
                boolean delivered = subscription.deliver(() -> {
                    if (!finished.compareAndSet(false, true)) {
                        LOGGER.debug("Ignoring stream error after finish: {}", error.toString());
                        return;
                    }
                    String message = error.getMessage() == null ? "Analysis stream failed" : error.getMessage();
                    LOGGER.warn("Analysis stream failed: {}", message);
                    listener.onError(message, null, List.of());
                });
                if (!delivered) {
                    LOGGER.debug("Ignoring stream error after cancel: {}", error.toString());
                }
            },
            () -> subscription.deliver(() -> {
                if (finished.compareAndSet(false, true)) {
                    LOGGER.warn(INCOMPLETE_STREAM_MESSAGE);
                    listener.onError(INCOMPLETE_STREAM_MESSAGE, null, List.of());
                }
            })
        );
        subscription.attach(disposable);
        return subscription;
    }

    private void dispatch(PipelineEvent event, PipelineStreamListener listener, AtomicBoolean finished) {
        if (event instanceof PipelineEvent.StageStarted) {
            listener.onProgress((PipelineEvent.StageStarted) event);
        } else if (event instanceof PipelineEvent.StageCompleted) {
            listener.onStageComplete((PipelineEvent.StageCompleted) event);
        } else if (event instanceof PipelineEvent.PipelineCompleted) {
            finished.set(true);
            listener.onComplete(((PipelineEvent.PipelineCompleted) event).result());
        } else if (event instanceof PipelineEvent.StageFailed) {
            PipelineEvent.StageFailed failed = (PipelineEvent.StageFailed) event;
            finished.set(true);
            listener.onError(failed.message(), failed.stage(), failed.completedStages());
        } else if (event instanceof PipelineEvent.PipelineFailed) {
            finished.set(true);
            listener.onError(((PipelineEvent.PipelineFailed) event).message(), null, List.of());
        }
    }
}
