package com.taskgraph.scheduler.config;

import com.taskgraph.core.channel.MessageChannel;
import com.taskgraph.core.message.MessageCodec;
import com.taskgraph.core.repository.ExecutionStore;
import com.taskgraph.engine.config.EngineProperties;
import com.taskgraph.scheduler.RetryTimerScheduler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RetryTimerConfiguration {

    @Bean
    public RetryTimerScheduler retryTimerScheduler(
            ExecutionStore executionStore,
            MessageChannel messageChannel,
            MessageCodec messageCodec,
            Clock clock,
            EngineProperties properties) {
        EngineProperties.RetryTimer timers = properties.getRetryTimer();
        return new RetryTimerScheduler(
            executionStore,
            messageChannel,
            messageCodec,
            clock,
            properties.getChannel().getResultTopic(),
            timers.getPollInterval(),
            timers.getBatchSize(),
            timers.getRefireAfter()
        );
    }
}
