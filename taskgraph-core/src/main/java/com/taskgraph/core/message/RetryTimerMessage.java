package com.taskgraph.core.message;

import java.util.UUID;

/**
 * Retry timer of a DELAYED task execution came due.
 */
public record RetryTimerMessage(UUID taskExecutionId, UUID executionId, int attempt) implements ChannelMessage {
}
