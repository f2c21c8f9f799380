package com.casekeep.analysis.event;

public interface PipelineEventSink {

    void send(PipelineEvent event);

    void close();
}
