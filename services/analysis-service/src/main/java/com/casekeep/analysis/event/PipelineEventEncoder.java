package com.casekeep.analysis.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.springframework.stereotype.Component;

@Component
public class PipelineEventEncoder {

    private final ObjectWriter writer;

    public PipelineEventEncoder(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerFor(PipelineEvent.class);
    }

    public String encode(PipelineEvent event) {
        try {
            return writer.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not encode " + event.getClass().getSimpleName(), ex);
        }
    }
}
