package com.taskgraph.engine.dispatch;

import java.util.UUID;

/**
 * Identifies one dispatched attempt. Results carrying a different attempt or nonce are stale.
 */
public record DispatchToken(UUID taskExecutionId, int attempt, UUID nonce) {
}
