package com.example.compliance.orchestrator.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;

@Slf4j
@Configuration
public class DispatchConfig {

    public static final String DISPATCH_EXECUTOR = "dispatchExecutor";

    /**
     * Runs workflow deliveries off the thread that acquired the dispatch guard, so no database
     * transaction stays open while the workflow answers.
     */
    @Bean(name = DISPATCH_EXECUTOR)
    public TaskExecutor dispatchExecutor(OrchestratorProperties properties) {
        int threads = properties.getDispatch().getExecutorThreads();
        if (threads <= 0) {
            log.info("[dispatcher] Deliveries run on the calling thread");
            return new SyncTaskExecutor();
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    public WebClient validationWorkflowWebClient(WebClient.Builder builder, OrchestratorProperties properties) {
        return builder
                .baseUrl(properties.getDispatch().getWebhookUrl())
                .build();
    }
}
