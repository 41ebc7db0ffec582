package com.taskgraph.engine.channel;

import com.taskgraph.core.channel.ChannelConsumer;
import com.taskgraph.core.channel.MessageChannel;
import com.taskgraph.core.exception.DispatchException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * In-process message channel for tests and single-node deployments.
 *
 * Each topic is one queue shared by its consumers. Polled messages that are not
 * committed before the consumer closes go back to the head of the queue, which
 * gives the same at-least-once behavior as a broker.
 */
public class InMemoryMessageChannel implements MessageChannel {

    private static final int MAX_BATCH = 100;

    private final Map<String, BlockingDeque<String>> topics = new ConcurrentHashMap<>();
    private volatile boolean closed;

    @Override
    public void publish(String topic, String key, String payload) {
        if (closed) {
            throw new DispatchException("Channel is closed, cannot publish to " + topic);
        }
        queue(topic).offerLast(payload);
    }

    @Override
    public ChannelConsumer openConsumer(String topic) {
        return new InMemoryConsumer(queue(topic));
    }

    /**
     * Messages published to the topic and not yet polled.
     */
    public int pending(String topic) {
        return queue(topic).size();
    }

    @Override
    public void close() {
        closed = true;
    }

    private BlockingDeque<String> queue(String topic) {
        return topics.computeIfAbsent(topic, t -> new LinkedBlockingDeque<>());
    }

    private final class InMemoryConsumer implements ChannelConsumer {

        private final BlockingDeque<String> queue;
        private final List<String> uncommitted = new ArrayList<>();

        InMemoryConsumer(BlockingDeque<String> queue) {
            this.queue = queue;
        }

        @Override
        public List<String> poll(Duration timeout) {
            if (closed) {
                return List.of();
            }
            try {
                String first = queue.pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (first == null) {
                    return List.of();
                }
                List<String> batch = new ArrayList<>();
                batch.add(first);
                queue.drainTo(batch, MAX_BATCH - 1);
                uncommitted.addAll(batch);
                return batch;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.of();
            }
        }

        @Override
        public void commit() {
            uncommitted.clear();
        }

        @Override
        public void close() {
            for (int i = uncommitted.size() - 1; i >= 0; i--) {
                queue.offerFirst(uncommitted.get(i));
            }
            uncommitted.clear();
        }
    }
}
