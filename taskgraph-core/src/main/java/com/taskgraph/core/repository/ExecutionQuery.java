package com.taskgraph.core.repository;

import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.ExecutionStatus;

import java.time.Instant;
import java.util.UUID;
import java.util.function.Function;

/**
 * Filter, order and page for listing executions. Defaults to oldest first.
 *
 * @param definitionName only executions of this workflow, or null for all
 * @param status only executions in this status, or null for all
 * @param marker id of the last execution of the previous page, or null for the first page
 * @param limit page size
 * @param sortKey timestamp to order by, ties broken by id
 * @param sortDirection ascending or descending
 */
public record ExecutionQuery(
    String definitionName,
    ExecutionStatus status,
    UUID marker,
    int limit,
    SortKey sortKey,
    SortDirection sortDirection
) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public enum SortKey {
        CREATED_AT("created_at", Execution::createdAt),
        UPDATED_AT("updated_at", Execution::updatedAt);

        private final String column;
        private final Function<Execution, Instant> extractor;

        SortKey(String column, Function<Execution, Instant> extractor) {
            this.column = column;
            this.extractor = extractor;
        }

        public String column() {
            return column;
        }

        public Instant valueOf(Execution execution) {
            return extractor.apply(execution);
        }

        /**
         * Parses {@code created_at} or {@code updated_at}, case-insensitively.
         */
        public static SortKey parse(String value) {
            for (SortKey key : values()) {
                if (key.column.equalsIgnoreCase(value)) {
                    return key;
                }
            }
            throw new IllegalArgumentException("Unknown sort key: " + value);
        }
    }

    public enum SortDirection {
        ASC, DESC;

        public static SortDirection parse(String value) {
            for (SortDirection direction : values()) {
                if (direction.name().equalsIgnoreCase(value)) {
                    return direction;
                }
            }
            throw new IllegalArgumentException("Unknown sort direction: " + value);
        }
    }

    public ExecutionQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
        sortKey = sortKey != null ? sortKey : SortKey.CREATED_AT;
        sortDirection = sortDirection != null ? sortDirection : SortDirection.ASC;
    }

    public ExecutionQuery(String definitionName, ExecutionStatus status, UUID marker, int limit) {
        this(definitionName, status, marker, limit, SortKey.CREATED_AT, SortDirection.ASC);
    }

    public static ExecutionQuery all() {
        return new ExecutionQuery(null, null, null, DEFAULT_LIMIT);
    }

    public ExecutionQuery after(UUID lastSeen) {
        return new ExecutionQuery(definitionName, status, lastSeen, limit, sortKey, sortDirection);
    }

    public ExecutionQuery sortedBy(SortKey key, SortDirection direction) {
        return new ExecutionQuery(definitionName, status, marker, limit, key, direction);
    }
}
