package com.casekeep.analysis.config;

import com.casekeep.analysis.stage.StageRegistry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class PipelineConfig {

    @Bean
    StageRegistry stageRegistry() {
        return StageRegistry.standard();
    }

    @Bean
    AsyncTaskExecutor pipelineTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("pipeline-");
        executor.initialize();
        return executor;
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService reasoningCallExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("reasoning-call-"));
    }
}
