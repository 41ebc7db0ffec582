package com.taskgraph.engine.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

public class KafkaHealthIndicatorTest {

    @Test
    @DisplayName("Unresolvable bootstrap servers should report DOWN")
    void testUnresolvableBootstrapServers() {
        KafkaHealthIndicator indicator = new KafkaHealthIndicator("no-such-broker.invalid:9092");

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails())
            .containsEntry("status", "disconnected")
            .containsEntry("bootstrapServers", "no-such-broker.invalid:9092");
    }

    @Test
    @DisplayName("Unreachable broker should report DOWN once the request times out")
    void testUnreachableBroker() {
        KafkaHealthIndicator indicator = new KafkaHealthIndicator("localhost:1");

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails())
            .containsEntry("status", "disconnected")
            .containsEntry("bootstrapServers", "localhost:1")
            .doesNotContainKey("brokerCount");
    }
}
