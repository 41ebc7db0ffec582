package com.taskgraph.engine.health;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

/**
 * Health indicator for Kafka connectivity.
 * Only registered when the Kafka channel is configured.
 */
public class KafkaHealthIndicator implements HealthIndicator {

    private static final int TIMEOUT_MS = 5000;

    private final String bootstrapServers;

    public KafkaHealthIndicator(String bootstrapServers) {
        this.bootstrapServers = bootstrapServers;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("bootstrapServers", bootstrapServers);

        Properties props = new Properties();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, TIMEOUT_MS);
        props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, TIMEOUT_MS);

        try (AdminClient adminClient = AdminClient.create(props)) {
            var nodes = adminClient.describeCluster().nodes().get(TIMEOUT_MS, TimeUnit.MILLISECONDS);
            details.put("brokerCount", nodes.size());
            details.put("status", "connected");
            return Health.up()
                .withDetails(details)
                .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Health.down(e)
                .withDetails(details)
                .build();
        } catch (Exception e) {
            // Run requests cannot be dispatched without the broker
            details.put("status", "disconnected");
            details.put("error", e.getMessage());
            return Health.down()
                .withDetails(details)
                .build();
        }
    }
}
