package com.taskgraph.engine.config;

import com.taskgraph.core.channel.MessageChannel;
import com.taskgraph.core.expression.ExpressionEvaluator;
import com.taskgraph.core.graph.GraphCompiler;
import com.taskgraph.core.message.MessageCodec;
import com.taskgraph.core.model.RetryPolicy;
import com.taskgraph.core.repository.DefinitionRepository;
import com.taskgraph.core.repository.ExecutionStore;
import com.taskgraph.engine.channel.InMemoryMessageChannel;
import com.taskgraph.engine.channel.KafkaMessageChannel;
import com.taskgraph.engine.coordinator.ExecutionCoordinator;
import com.taskgraph.engine.coordinator.GraphCache;
import com.taskgraph.engine.coordinator.WorkflowCoordinator;
import com.taskgraph.engine.dispatch.Dispatcher;
import com.taskgraph.engine.health.EngineHealthIndicator;
import com.taskgraph.engine.health.KafkaHealthIndicator;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.engine.persistence.InMemoryDefinitionRepository;
import com.taskgraph.engine.persistence.InMemoryExecutionStore;
import com.taskgraph.engine.persistence.jdbc.JdbcDefinitionRepository;
import com.taskgraph.engine.persistence.jdbc.JdbcExecutionStore;
import com.taskgraph.engine.reconciler.EventReconciler;
import com.taskgraph.engine.reconciler.ReconcilerWorkerPool;
import com.taskgraph.engine.scheduler.Scheduler;
import com.taskgraph.engine.service.WorkflowService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

/**
 * Wires the engine: store, channel, scheduler, coordinator and reconciler.
 * Store and channel implementations are chosen by {@code taskgraph.store} and
 * {@code taskgraph.channel.type}.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MessageCodec messageCodec() {
        return new MessageCodec();
    }

    @Bean
    public GraphCompiler graphCompiler() {
        return new GraphCompiler();
    }

    @Bean
    public EngineMetrics engineMetrics() {
        return new EngineMetrics();
    }

    // ========== Persistence ==========

    @Bean
    @ConditionalOnProperty(name = "taskgraph.store", havingValue = "memory", matchIfMissing = true)
    public ExecutionStore inMemoryExecutionStore(Clock clock) {
        return new InMemoryExecutionStore(clock);
    }

    @Bean
    @ConditionalOnProperty(name = "taskgraph.store", havingValue = "memory", matchIfMissing = true)
    public DefinitionRepository inMemoryDefinitionRepository() {
        return new InMemoryDefinitionRepository();
    }

    @Bean
    @ConditionalOnProperty(name = "taskgraph.store", havingValue = "jdbc")
    public ExecutionStore jdbcExecutionStore(
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            MessageCodec codec,
            Clock clock) {
        return new JdbcExecutionStore(jdbcTemplate, transactionManager, codec.objectMapper(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "taskgraph.store", havingValue = "jdbc")
    public DefinitionRepository jdbcDefinitionRepository(JdbcTemplate jdbcTemplate, MessageCodec codec) {
        return new JdbcDefinitionRepository(jdbcTemplate, codec.objectMapper());
    }

    // ========== Channel ==========

    @Bean
    @ConditionalOnProperty(name = "taskgraph.channel.type", havingValue = "memory", matchIfMissing = true)
    public MessageChannel inMemoryMessageChannel() {
        return new InMemoryMessageChannel();
    }

    @Bean
    @ConditionalOnProperty(name = "taskgraph.channel.type", havingValue = "kafka")
    public MessageChannel kafkaMessageChannel(EngineProperties properties) {
        EngineProperties.Kafka kafka = properties.getKafka();
        return KafkaMessageChannel.connect(kafka.getBootstrapServers(), kafka.getGroupId(), kafka.getSendTimeout());
    }

    @Bean
    @ConditionalOnProperty(name = "taskgraph.channel.type", havingValue = "kafka")
    public KafkaHealthIndicator kafkaHealthIndicator(EngineProperties properties) {
        return new KafkaHealthIndicator(properties.getKafka().getBootstrapServers());
    }

    // ========== Engine ==========

    @Bean
    public Scheduler scheduler() {
        return new Scheduler(new ExpressionEvaluator());
    }

    @Bean
    public GraphCache graphCache(DefinitionRepository definitionRepository, GraphCompiler compiler) {
        return new GraphCache(definitionRepository, compiler);
    }

    @Bean
    public Dispatcher dispatcher(
            MessageChannel channel,
            ExecutionStore executionStore,
            MessageCodec codec,
            EngineMetrics metrics,
            Clock clock,
            EngineProperties properties) {
        EngineProperties.Dispatch dispatch = properties.getDispatch();
        RetryPolicy publishRetry = RetryPolicy.builder()
            .maxAttempts(dispatch.getMaxAttempts())
            .initialDelay(dispatch.getInitialBackoff())
            .maxDelay(dispatch.getMaxBackoff())
            .build();
        return new Dispatcher(
            channel, executionStore, codec, metrics, clock,
            properties.getChannel().getRunRequestTopic(), publishRetry
        );
    }

    @Bean
    public ExecutionCoordinator executionCoordinator(
            ExecutionStore executionStore,
            GraphCache graphCache,
            Scheduler scheduler,
            Dispatcher dispatcher,
            EngineMetrics metrics,
            Clock clock,
            EngineProperties properties) {
        return new ExecutionCoordinator(
            executionStore, graphCache, scheduler, dispatcher, metrics, clock,
            properties.getCoordinator().getMaxConflictRetries()
        );
    }

    @Bean
    public WorkflowService workflowService(
            DefinitionRepository definitionRepository,
            ExecutionStore executionStore,
            ExecutionCoordinator executionCoordinator,
            GraphCompiler compiler,
            Clock clock) {
        return new WorkflowCoordinator(definitionRepository, executionStore, executionCoordinator, compiler, clock);
    }

    // ========== Reconciler ==========

    @Bean
    public EventReconciler eventReconciler(
            ExecutionStore executionStore,
            ExecutionCoordinator executionCoordinator,
            MessageCodec codec,
            EngineMetrics metrics) {
        return new EventReconciler(executionStore, executionCoordinator, codec, metrics);
    }

    @Bean
    public ReconcilerWorkerPool reconcilerWorkerPool(
            MessageChannel channel,
            EventReconciler reconciler,
            EngineProperties properties) {
        EngineProperties.Reconciler settings = properties.getReconciler();
        return new ReconcilerWorkerPool(
            channel, reconciler, properties.getChannel().getResultTopic(),
            settings.getThreads(), settings.getPollTimeout()
        );
    }

    @Bean
    public EngineHealthIndicator engineHealthIndicator(
            ExecutionStore executionStore,
            ReconcilerWorkerPool reconcilerWorkerPool,
            Clock clock,
            EngineProperties properties) {
        return new EngineHealthIndicator(
            executionStore, reconcilerWorkerPool, clock,
            properties.getRecovery().getDispatchConfirmTimeout()
        );
    }
}
