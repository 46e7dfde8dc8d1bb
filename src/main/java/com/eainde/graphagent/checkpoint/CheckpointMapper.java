package com.eainde.graphagent.checkpoint;

import com.eainde.graphagent.error.CheckpointException;
import com.eainde.graphagent.state.SessionState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON form of a checkpoint. Both stores go through here so a state written by
 * one process reads back identically in another.
 */
public class CheckpointMapper {

    private final ObjectMapper objectMapper;

    public CheckpointMapper() {
        this(defaultObjectMapper());
    }

    public CheckpointMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String write(SessionState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to serialize session " + state.sessionId(), e);
        }
    }

    public SessionState read(String sessionId, String json) {
        try {
            return objectMapper.readValue(json, SessionState.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to deserialize session " + sessionId, e);
        }
    }
}
