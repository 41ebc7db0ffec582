package com.taskgraph.worker.config;

import com.taskgraph.core.channel.MessageChannel;
import com.taskgraph.core.message.MessageCodec;
import com.taskgraph.engine.config.EngineProperties;
import com.taskgraph.worker.Action;
import com.taskgraph.worker.ActionRegistry;
import com.taskgraph.worker.ActionWorker;
import com.taskgraph.worker.EchoAction;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Embedded action executor, for single-process deployments.
 * Every {@link Action} bean in the context is registered.
 */
@Configuration
@ConditionalOnProperty(name = "taskgraph.worker.enabled", havingValue = "true")
public class WorkerConfiguration {

    @Bean
    public EchoAction echoAction() {
        return new EchoAction();
    }

    @Bean
    public ActionRegistry actionRegistry(List<Action> actions) {
        return new ActionRegistry(actions);
    }

    @Bean
    public ActionWorker actionWorker(
            MessageChannel messageChannel,
            ActionRegistry actionRegistry,
            MessageCodec messageCodec,
            EngineProperties properties) {
        return new ActionWorker(
            messageChannel,
            actionRegistry,
            messageCodec,
            properties.getChannel().getRunRequestTopic(),
            properties.getChannel().getResultTopic(),
            properties.getWorker().getThreads(),
            properties.getReconciler().getPollTimeout()
        );
    }
}
