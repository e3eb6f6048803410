package org.audioshelf.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskExecutorConfig {

    public static final String RESOLUTION_EXECUTOR = "resolutionExecutor";
    public static final String ADAPTER_EXECUTOR = "adapterExecutor";

    @Bean(name = RESOLUTION_EXECUTOR)
    public ThreadPoolTaskExecutor resolutionExecutor(AppProperties appProperties) {
        int parallelism = Math.max(1, appProperties.getResolution().getParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setThreadNamePrefix("resolve-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    // Calls abandoned after a timeout keep their thread until the vendor client returns.
    @Bean(name = ADAPTER_EXECUTOR)
    public ThreadPoolTaskExecutor adapterExecutor(AppProperties appProperties) {
        int parallelism = Math.max(1, appProperties.getResolution().getParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism * 2);
        executor.setMaxPoolSize(parallelism * 2);
        executor.setThreadNamePrefix("adapter-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
