package com.smartstream.transform.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskExecutorConfig {

    @Value("${app.transform.worker.core-pool-size:4}")
    private int corePoolSize;

    @Value("${app.transform.worker.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${app.transform.worker.queue-capacity:100}")
    private int queueCapacity;

    // One task per raw object; objects share no state
    @Bean("rawObjectTransformExecutor")
    public TaskExecutor rawObjectTransformExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Math.max(corePoolSize, maxPoolSize));
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("TransformWorker-");
        executor.initialize();
        return executor;
    }
}
