package io.contimg.pipeline.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the managed thread pools for pipeline work. Group pipelines and individual stage
 * invocations run on separate pools so a group waiting on its stage futures never starves the stages.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Runs a single stage body so that the caller can bound it with a timeout and cancel it.
     */
    @Bean("stageTaskExecutor")
    public AsyncTaskExecutor stageTaskExecutor(@Value("${app.executor.stage.core-size:4}") int coreSize,
                                               @Value("${app.executor.stage.max-size:8}") int maxSize,
                                               @Value("${app.executor.stage.queue-capacity:200}") int queueCapacity) {
        return buildExecutor("stage-", coreSize, maxSize, queueCapacity);
    }

    /**
     * Drives whole groups through the stage sequence and replays dead letters.
     */
    @Bean("groupTaskExecutor")
    public AsyncTaskExecutor groupTaskExecutor(@Value("${app.executor.group.core-size:2}") int coreSize,
                                               @Value("${app.executor.group.max-size:4}") int maxSize,
                                               @Value("${app.executor.group.queue-capacity:100}") int queueCapacity) {
        return buildExecutor("group-", coreSize, maxSize, queueCapacity);
    }

    private static ThreadPoolTaskExecutor buildExecutor(String prefix, int coreSize, int maxSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
