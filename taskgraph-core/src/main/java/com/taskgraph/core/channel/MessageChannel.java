package com.taskgraph.core.channel;

/**
 * Asynchronous, at-least-once message transport between the engine and action executors.
 */
public interface MessageChannel extends AutoCloseable {

    /**
     * Hand a message to the transport.
     *
     * @param key partitioning key; messages with the same key keep their order
     * @throws com.taskgraph.core.exception.DispatchException if the transport rejected the message
     */
    void publish(String topic, String key, String payload);

    /**
     * Open a consumer on the topic. Consumers of the same topic compete for messages.
     * A consumer is owned by a single thread.
     */
    ChannelConsumer openConsumer(String topic);

    @Override
    default void close() {
    }
}
