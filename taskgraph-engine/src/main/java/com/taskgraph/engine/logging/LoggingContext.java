package com.taskgraph.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include relevant correlation IDs for tracing.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(executionId, "fetch", taskExecutionId, 1)) {
 *     log.info("Dispatching task"); // Automatically includes executionId, taskName, attempt
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [reconciler-1] INFO  c.t.e.c.ExecutionCoordinator - Task completed
 *   executionId=abc-123 taskName=fetch attempt=1 traceId=9f2c01aa
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EXECUTION_ID = "executionId";
    public static final String TASK_NAME = "taskName";
    public static final String TASK_EXECUTION_ID = "taskExecutionId";
    public static final String ATTEMPT = "attempt";
    public static final String WORKER_ID = "workerId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for execution-level operations.
     */
    public static LoggingContext forExecution(UUID executionId) {
        LoggingContext ctx = new LoggingContext();
        if (executionId != null) {
            MDC.put(EXECUTION_ID, executionId.toString());
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for task-level operations.
     */
    public static LoggingContext forTask(UUID executionId, String taskName, UUID taskExecutionId, int attempt) {
        LoggingContext ctx = forExecution(executionId);
        if (taskName != null) {
            MDC.put(TASK_NAME, taskName);
        }
        if (taskExecutionId != null) {
            MDC.put(TASK_EXECUTION_ID, taskExecutionId.toString());
        }
        MDC.put(ATTEMPT, String.valueOf(attempt));
        return ctx;
    }

    /**
     * Create a logging context for background worker loops.
     */
    public static LoggingContext forWorker(String workerId) {
        LoggingContext ctx = new LoggingContext();
        if (workerId != null) {
            MDC.put(WORKER_ID, workerId);
        }
        ensureTraceId();
        return ctx;
    }

    public static String getExecutionId() {
        return MDC.get(EXECUTION_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(EXECUTION_ID);
        MDC.remove(TASK_NAME);
        MDC.remove(TASK_EXECUTION_ID);
        MDC.remove(ATTEMPT);
        // Keep WORKER_ID and TRACE_ID for the enclosing loop
    }

    /**
     * Clear all MDC context. Call at the end of a worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
