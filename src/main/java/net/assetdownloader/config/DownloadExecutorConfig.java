package net.assetdownloader.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor that drives download runs. One thread is enough: only one run may be active,
 * and each run fans its jobs out to its own bounded worker pool.
 */
@Configuration
public class DownloadExecutorConfig {

    private static final int RUN_EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS = 30;

    @Bean(name = "downloadRunExecutor")
    public ThreadPoolTaskExecutor downloadRunExecutor(DownloaderProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix(properties.getRunThreadPrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(RUN_EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS);
        executor.initialize();
        return executor;
    }
}
