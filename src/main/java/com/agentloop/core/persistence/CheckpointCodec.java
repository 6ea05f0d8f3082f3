package com.agentloop.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import java.util.Map;

/**
 * JSON encoding of {@link LoopSnapshot}s and of raw graph state maps, shared by the savers.
 */
final class CheckpointCodec {

    private final ObjectMapper mapper;

    CheckpointCodec() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    ObjectMapper mapper() {
        return mapper;
    }

    String encode(LoopSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to serialize snapshot for session " + snapshot.sessionId(), e);
        }
    }

    LoopSnapshot decode(String json) {
        try {
            return mapper.readValue(json, LoopSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to deserialize snapshot: " + e.getOriginalMessage(), e);
        }
    }

    String writeState(Map<String, Object> state) {
        try {
            return mapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to serialize checkpoint state", e);
        }
    }

    Map<String, Object> readState(String json) {
        try {
            return mapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to deserialize checkpoint state: " + e.getOriginalMessage(), e);
        }
    }
}
