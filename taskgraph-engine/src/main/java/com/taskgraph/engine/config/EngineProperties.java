package com.taskgraph.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine settings under the {@code taskgraph} prefix.
 */
@ConfigurationProperties(prefix = "taskgraph")
public class EngineProperties {

    public enum StoreType {
        MEMORY,
        JDBC
    }

    public enum ChannelType {
        MEMORY,
        KAFKA
    }

    private StoreType store = StoreType.MEMORY;
    private final Channel channel = new Channel();
    private final Kafka kafka = new Kafka();
    private final Reconciler reconciler = new Reconciler();
    private final Coordinator coordinator = new Coordinator();
    private final Dispatch dispatch = new Dispatch();
    private final RetryTimer retryTimer = new RetryTimer();
    private final Recovery recovery = new Recovery();
    private final Worker worker = new Worker();

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public Channel getChannel() {
        return channel;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Reconciler getReconciler() {
        return reconciler;
    }

    public Coordinator getCoordinator() {
        return coordinator;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public RetryTimer getRetryTimer() {
        return retryTimer;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public Worker getWorker() {
        return worker;
    }

    public static class Channel {
        private ChannelType type = ChannelType.MEMORY;
        private String runRequestTopic = "taskgraph.run-requests";
        private String resultTopic = "taskgraph.results";

        public ChannelType getType() {
            return type;
        }

        public void setType(ChannelType type) {
            this.type = type;
        }

        public String getRunRequestTopic() {
            return runRequestTopic;
        }

        public void setRunRequestTopic(String runRequestTopic) {
            this.runRequestTopic = runRequestTopic;
        }

        public String getResultTopic() {
            return resultTopic;
        }

        public void setResultTopic(String resultTopic) {
            this.resultTopic = resultTopic;
        }
    }

    public static class Kafka {
        private String bootstrapServers = "localhost:9092";
        private String groupId = "taskgraph-engine";
        private Duration sendTimeout = Duration.ofSeconds(10);

        public String getBootstrapServers() {
            return bootstrapServers;
        }

        public void setBootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
        }

        public String getGroupId() {
            return groupId;
        }

        public void setGroupId(String groupId) {
            this.groupId = groupId;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }
    }

    public static class Reconciler {
        private int threads = 4;
        private Duration pollTimeout = Duration.ofMillis(500);

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }
    }

    public static class Coordinator {
        private int maxConflictRetries = 10;

        public int getMaxConflictRetries() {
            return maxConflictRetries;
        }

        public void setMaxConflictRetries(int maxConflictRetries) {
            this.maxConflictRetries = maxConflictRetries;
        }
    }

    public static class Dispatch {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(100);
        private Duration maxBackoff = Duration.ofSeconds(2);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static class RetryTimer {
        private Duration pollInterval = Duration.ofSeconds(1);
        private int batchSize = 100;
        // A timer still due after this long is published again
        private Duration refireAfter = Duration.ofSeconds(30);

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getRefireAfter() {
            return refireAfter;
        }

        public void setRefireAfter(Duration refireAfter) {
            this.refireAfter = refireAfter;
        }
    }

    public static class Recovery {
        private Duration interval = Duration.ofSeconds(10);
        private Duration dispatchConfirmTimeout = Duration.ofSeconds(30);
        private int maxDispatchAttempts = 5;
        private Duration unstartedThreshold = Duration.ofSeconds(30);
        private int batchSize = 100;

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getDispatchConfirmTimeout() {
            return dispatchConfirmTimeout;
        }

        public void setDispatchConfirmTimeout(Duration dispatchConfirmTimeout) {
            this.dispatchConfirmTimeout = dispatchConfirmTimeout;
        }

        public int getMaxDispatchAttempts() {
            return maxDispatchAttempts;
        }

        public void setMaxDispatchAttempts(int maxDispatchAttempts) {
            this.maxDispatchAttempts = maxDispatchAttempts;
        }

        public Duration getUnstartedThreshold() {
            return unstartedThreshold;
        }

        public void setUnstartedThreshold(Duration unstartedThreshold) {
            this.unstartedThreshold = unstartedThreshold;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Worker {
        private boolean enabled = false;
        private int threads = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }
}
