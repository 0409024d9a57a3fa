package com.starscape.rapidresize.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker threads for load sessions and batch save runs.
 *
 * <p>Each session or run occupies one thread for its whole lifetime; work submitted while all
 * threads are busy waits in the queue.
 */
@Configuration
public class WorkerConfig {

    @Bean(name = "resizeWorkerExecutor")
    public TaskExecutor resizeWorkerExecutor(ProcessingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerThreads());
        executor.setMaxPoolSize(properties.getWorkerThreads());
        executor.setQueueCapacity(32);
        executor.setDaemon(true);
        executor.setThreadNamePrefix("resize-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
