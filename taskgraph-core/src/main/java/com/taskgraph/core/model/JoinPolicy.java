package com.taskgraph.core.model;

/**
 * How many satisfied inputs a task needs before it runs.
 *
 * Applied to incoming transitions (task join) and to with-items siblings (items join).
 */
public record JoinPolicy(Kind kind, int count) {

    public enum Kind {
        /** No join: the first arriving edge activates the task, later edges are ignored. */
        NONE,
        /** All declared inputs must be satisfied. */
        ALL,
        /** The first satisfied input is enough. */
        ONE,
        /** At least {@code count} inputs must be satisfied. */
        COUNT
    }

    public static JoinPolicy none() {
        return new JoinPolicy(Kind.NONE, 0);
    }

    public static JoinPolicy all() {
        return new JoinPolicy(Kind.ALL, 0);
    }

    public static JoinPolicy one() {
        return new JoinPolicy(Kind.ONE, 1);
    }

    public static JoinPolicy count(int count) {
        return new JoinPolicy(Kind.COUNT, count);
    }

    /**
     * Number of satisfied inputs required out of {@code total}.
     */
    public int required(int total) {
        return switch (kind) {
            case NONE, ONE -> Math.min(1, total);
            case ALL -> total;
            case COUNT -> count;
        };
    }

    @Override
    public String toString() {
        return kind == Kind.COUNT ? "count(" + count + ")" : kind.name().toLowerCase();
    }
}
