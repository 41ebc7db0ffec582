package com.taskgraph.core.channel;

import java.time.Duration;
import java.util.List;

/**
 * Single-threaded reader of one topic.
 * Messages returned by {@link #poll} are redelivered unless {@link #commit} follows.
 */
public interface ChannelConsumer extends AutoCloseable {

    /**
     * Wait up to the timeout for messages.
     *
     * @return payloads in delivery order, empty on timeout
     */
    List<String> poll(Duration timeout);

    /**
     * Acknowledge everything returned by previous polls.
     */
    void commit();

    @Override
    void close();
}
