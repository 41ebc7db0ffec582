package com.taskgraph.engine.channel;

import com.taskgraph.core.channel.ChannelConsumer;
import com.taskgraph.core.channel.MessageChannel;
import com.taskgraph.core.exception.DispatchException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Message channel backed by Kafka.
 *
 * Publishing waits for the broker acknowledgement so that a returned publish
 * means the message is durable. Consumers disable auto-commit; offsets are
 * committed explicitly after the messages were handled.
 */
public class KafkaMessageChannel implements MessageChannel {

    private static final Logger log = LoggerFactory.getLogger(KafkaMessageChannel.class);

    private final Producer<String, String> producer;
    private final Supplier<Consumer<String, String>> consumerFactory;
    private final Duration sendTimeout;

    public KafkaMessageChannel(
            Producer<String, String> producer,
            Supplier<Consumer<String, String>> consumerFactory,
            Duration sendTimeout) {
        this.producer = producer;
        this.consumerFactory = consumerFactory;
        this.sendTimeout = sendTimeout;
    }

    /**
     * Channel with real Kafka clients for the given cluster and consumer group.
     */
    public static KafkaMessageChannel connect(String bootstrapServers, String groupId, Duration sendTimeout) {
        Properties producerProps = new Properties();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());

        Properties consumerProps = new Properties();
        consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());

        log.info("Connecting Kafka channel to {} as group {}", bootstrapServers, groupId);
        return new KafkaMessageChannel(
            new KafkaProducer<>(producerProps),
            () -> new KafkaConsumer<>(consumerProps),
            sendTimeout
        );
    }

    @Override
    public void publish(String topic, String key, String payload) {
        try {
            producer.send(new ProducerRecord<>(topic, key, payload))
                .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException e) {
            throw new DispatchException("Kafka rejected message for " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new DispatchException("Timed out publishing to " + topic + " after " + sendTimeout, e);
        } catch (KafkaException e) {
            // Raised by send() itself, before the record reached the buffer
            throw new DispatchException("Kafka refused message for " + topic, e);
        }
    }

    @Override
    public ChannelConsumer openConsumer(String topic) {
        Consumer<String, String> consumer = consumerFactory.get();
        consumer.subscribe(List.of(topic));
        return new KafkaChannelConsumer(consumer);
    }

    @Override
    public void close() {
        producer.close(Duration.ofSeconds(10));
    }

    private static final class KafkaChannelConsumer implements ChannelConsumer {

        private final Consumer<String, String> consumer;

        KafkaChannelConsumer(Consumer<String, String> consumer) {
            this.consumer = consumer;
        }

        @Override
        public List<String> poll(Duration timeout) {
            List<String> payloads = new ArrayList<>();
            for (ConsumerRecord<String, String> record : consumer.poll(timeout)) {
                payloads.add(record.value());
            }
            return payloads;
        }

        @Override
        public void commit() {
            consumer.commitSync();
        }

        @Override
        public void close() {
            consumer.close();
        }
    }
}
