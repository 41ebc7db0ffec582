package com.taskgraph.core.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.UUID;

/**
 * Message on the result topic, consumed by the event reconciler.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TaskCompletionMessage.class, name = "completion"),
    @JsonSubTypes.Type(value = RetryTimerMessage.class, name = "retry-timer")
})
public interface ChannelMessage {

    UUID taskExecutionId();

    UUID executionId();

    int attempt();
}
