package com.taskgraph.engine.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.exception.ConflictException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.model.DefinitionId;
import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.ExecutionSnapshot;
import com.taskgraph.core.model.ExecutionStatus;
import com.taskgraph.core.model.TaskExecution;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.repository.ExecutionQuery;
import com.taskgraph.core.repository.ExecutionStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of ExecutionStore.
 * For tests and single-node deployments; state is lost on restart.
 *
 * A single monitor guards all writes, which makes commits atomic across
 * the execution and its task executions.
 */
public class InMemoryExecutionStore implements ExecutionStore {

    private static final Comparator<Execution> CREATION_ORDER =
        Comparator.comparing(Execution::createdAt).thenComparing(Execution::id);

    private final Clock clock;
    private final Object lock = new Object();

    private final Map<UUID, Execution> executions = new LinkedHashMap<>();
    // Per execution, in creation order
    private final Map<UUID, Map<UUID, TaskExecution>> taskExecutions = new LinkedHashMap<>();
    private final Map<UUID, UUID> taskOwners = new LinkedHashMap<>();

    public InMemoryExecutionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Execution createExecution(DefinitionId definitionId, JsonNode input) {
        Execution execution = Execution.create(definitionId, input, clock.instant());
        synchronized (lock) {
            executions.put(execution.id(), execution);
            taskExecutions.put(execution.id(), new LinkedHashMap<>());
        }
        return execution;
    }

    @Override
    public ExecutionSnapshot loadForUpdate(UUID executionId) {
        synchronized (lock) {
            Execution execution = executions.get(executionId);
            if (execution == null) {
                throw new NotFoundException("Execution", executionId);
            }
            return new ExecutionSnapshot(execution, new ArrayList<>(taskExecutions.get(executionId).values()));
        }
    }

    @Override
    public void commit(Execution execution, Collection<TaskExecution> changedTaskExecutions) {
        synchronized (lock) {
            Execution stored = executions.get(execution.id());
            if (stored == null) {
                throw new NotFoundException("Execution", execution.id());
            }
            if (stored.version() != execution.version() - 1) {
                throw new ConflictException("Execution", execution.id().toString(),
                    execution.version() - 1, stored.version());
            }
            executions.put(execution.id(), execution);

            Map<UUID, TaskExecution> tasks = taskExecutions.get(execution.id());
            for (TaskExecution task : changedTaskExecutions) {
                tasks.put(task.id(), mergeDispatchState(tasks.get(task.id()), task));
                taskOwners.put(task.id(), execution.id());
            }
        }
    }

    /**
     * Keep dispatch confirmations recorded after the snapshot was taken.
     */
    private static TaskExecution mergeDispatchState(TaskExecution stored, TaskExecution updated) {
        if (stored == null || stored.dispatchNonce() == null
                || !stored.dispatchNonce().equals(updated.dispatchNonce())) {
            return updated;
        }
        return updated.toBuilder()
            .dispatchConfirmedAt(updated.dispatchConfirmedAt() != null
                ? updated.dispatchConfirmedAt() : stored.dispatchConfirmedAt())
            .dispatchCount(Math.max(updated.dispatchCount(), stored.dispatchCount()))
            .dispatchedAt(latest(updated.dispatchedAt(), stored.dispatchedAt()))
            .build();
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    // ========== Queries ==========

    @Override
    public Optional<Execution> findExecution(UUID executionId) {
        synchronized (lock) {
            return Optional.ofNullable(executions.get(executionId));
        }
    }

    @Override
    public Optional<TaskExecution> findTaskExecution(UUID taskExecutionId) {
        synchronized (lock) {
            UUID owner = taskOwners.get(taskExecutionId);
            return owner != null
                ? Optional.ofNullable(taskExecutions.get(owner).get(taskExecutionId))
                : Optional.empty();
        }
    }

    @Override
    public List<TaskExecution> listTaskExecutions(UUID executionId) {
        synchronized (lock) {
            Map<UUID, TaskExecution> tasks = taskExecutions.get(executionId);
            return tasks != null ? new ArrayList<>(tasks.values()) : List.of();
        }
    }

    @Override
    public List<Execution> listExecutions(ExecutionQuery query) {
        synchronized (lock) {
            Execution marker = null;
            if (query.marker() != null) {
                marker = executions.get(query.marker());
                if (marker == null) {
                    throw new NotFoundException("Execution", query.marker());
                }
            }
            Execution after = marker;
            Comparator<Execution> order = listingOrder(query);
            return executions.values().stream()
                .filter(e -> query.definitionName() == null || e.definitionName().equals(query.definitionName()))
                .filter(e -> query.status() == null || e.status() == query.status())
                .filter(e -> after == null || order.compare(e, after) > 0)
                .sorted(order)
                .limit(query.limit())
                .collect(Collectors.toList());
        }
    }

    private static Comparator<Execution> listingOrder(ExecutionQuery query) {
        Comparator<Execution> order = Comparator.<Execution, Instant>comparing(query.sortKey()::valueOf)
            .thenComparing(Execution::id);
        return query.sortDirection() == ExecutionQuery.SortDirection.DESC ? order.reversed() : order;
    }

    @Override
    public Map<ExecutionStatus, Long> countByStatus() {
        Map<ExecutionStatus, Long> counts = new EnumMap<>(ExecutionStatus.class);
        synchronized (lock) {
            executions.values().forEach(e -> counts.merge(e.status(), 1L, Long::sum));
        }
        return counts;
    }

    // ========== Sweeps ==========

    @Override
    public List<TaskExecution> findDueRetries(Instant now, int limit) {
        synchronized (lock) {
            return allTasks()
                .filter(t -> t.status() == TaskStatus.DELAYED)
                .filter(t -> t.retryAt() != null && !t.retryAt().isAfter(now))
                .filter(t -> executions.get(t.executionId()).status() == ExecutionStatus.RUNNING)
                .sorted(Comparator.comparing(TaskExecution::retryAt))
                .limit(limit)
                .collect(Collectors.toList());
        }
    }

    @Override
    public List<TaskExecution> findUnconfirmedDispatches(Instant dispatchedBefore, int limit) {
        synchronized (lock) {
            return allTasks()
                .filter(t -> t.status() == TaskStatus.RUNNING)
                .filter(t -> t.dispatchConfirmedAt() == null)
                .filter(t -> t.dispatchedAt() != null && t.dispatchedAt().isBefore(dispatchedBefore))
                .sorted(Comparator.comparing(TaskExecution::dispatchedAt))
                .limit(limit)
                .collect(Collectors.toList());
        }
    }

    @Override
    public List<TaskExecution> findTimedOutTasks(Instant now, int limit) {
        synchronized (lock) {
            return allTasks()
                .filter(t -> t.status() == TaskStatus.RUNNING)
                .filter(t -> t.timeoutAt() != null && !t.timeoutAt().isAfter(now))
                .sorted(Comparator.comparing(TaskExecution::timeoutAt))
                .limit(limit)
                .collect(Collectors.toList());
        }
    }

    @Override
    public List<Execution> findUnstartedExecutions(Instant createdBefore, int limit) {
        synchronized (lock) {
            return executions.values().stream()
                .filter(e -> !e.isTerminal() && !e.isStarted())
                .filter(e -> e.createdAt().isBefore(createdBefore))
                .sorted(CREATION_ORDER)
                .limit(limit)
                .collect(Collectors.toList());
        }
    }

    private Stream<TaskExecution> allTasks() {
        return taskExecutions.values().stream().flatMap(tasks -> tasks.values().stream());
    }

    // ========== Dispatch bookkeeping ==========

    @Override
    public boolean markDispatched(UUID taskExecutionId, UUID nonce, Instant at) {
        synchronized (lock) {
            TaskExecution task = findTaskExecution(taskExecutionId).orElse(null);
            if (task == null || !nonce.equals(task.dispatchNonce())) {
                return false;
            }
            if (task.dispatchConfirmedAt() == null) {
                replace(task.toBuilder().dispatchConfirmedAt(at).build());
            }
            return true;
        }
    }

    @Override
    public boolean recordDispatchAttempt(UUID taskExecutionId, UUID nonce, Instant at) {
        synchronized (lock) {
            TaskExecution task = findTaskExecution(taskExecutionId).orElse(null);
            if (task == null || task.status() != TaskStatus.RUNNING || !nonce.equals(task.dispatchNonce())) {
                return false;
            }
            replace(task.toBuilder()
                .dispatchCount(task.dispatchCount() + 1)
                .dispatchedAt(at)
                .build());
            return true;
        }
    }

    private void replace(TaskExecution task) {
        taskExecutions.get(task.executionId()).put(task.id(), task);
    }

    @Override
    public boolean deleteExecution(UUID executionId) {
        synchronized (lock) {
            if (executions.remove(executionId) == null) {
                return false;
            }
            Map<UUID, TaskExecution> tasks = taskExecutions.remove(executionId);
            if (tasks != null) {
                tasks.keySet().forEach(taskOwners::remove);
            }
            return true;
        }
    }
}
