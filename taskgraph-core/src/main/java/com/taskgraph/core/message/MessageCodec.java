package com.taskgraph.core.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskgraph.core.exception.MessageFormatException;

/**
 * JSON encoding of channel payloads.
 */
public class MessageCodec {

    private final ObjectMapper objectMapper;

    public MessageCodec() {
        this(defaultObjectMapper());
    }

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Object mapper used when none is supplied by the container.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public String encode(RunRequest request) {
        return write(request, RunRequest.class);
    }

    public String encode(ChannelMessage message) {
        return write(message, ChannelMessage.class);
    }

    public RunRequest decodeRunRequest(String payload) {
        return read(payload, RunRequest.class);
    }

    public ChannelMessage decodeChannelMessage(String payload) {
        return read(payload, ChannelMessage.class);
    }

    private String write(Object value, Class<?> type) {
        try {
            return objectMapper.writerFor(type).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MessageFormatException("Failed to encode " + type.getSimpleName(), e);
        }
    }

    private <T> T read(String payload, Class<T> type) {
        if (payload == null || payload.isBlank()) {
            throw new MessageFormatException("Empty " + type.getSimpleName() + " payload", null);
        }
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new MessageFormatException("Failed to decode " + type.getSimpleName(), e);
        }
    }
}
