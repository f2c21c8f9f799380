package com.casekeep.analysis.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PipelineEventParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineEventParser.class);

    private final ObjectMapper objectMapper;

    public PipelineEventParser() {
        this(new ObjectMapper());
    }

    public PipelineEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Optional<PipelineEvent> parse(String data) {
        try {
            return Optional.ofNullable(objectMapper.readValue(data, PipelineEvent.class));
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Skipping unparseable stream event: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
    }
}
