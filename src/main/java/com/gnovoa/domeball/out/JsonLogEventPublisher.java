package com.gnovoa.domeball.out;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.domeball.events.MatchEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes events to JSON and writes them to the log at DEBUG. The JSON is the same document a
 * live viewer or a replay store would receive.
 */
public final class JsonLogEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(JsonLogEventPublisher.class);

    private final ObjectMapper mapper;

    public JsonLogEventPublisher(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void publish(MatchEvent event) {
        if (!log.isDebugEnabled()) return;
        try {
            log.debug("Publishing event {}: {}", event.id(), toJson(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event {}", event.id(), e);
        }
    }

    public String toJson(MatchEvent event) throws JsonProcessingException {
        return mapper.writeValueAsString(event);
    }
}
