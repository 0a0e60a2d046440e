package com.unifiedinbox.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableScheduling
public class SyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${sync.http.connect-timeout:PT10S}") Duration connectTimeout,
                                     @Value("${sync.http.read-timeout:PT30S}") Duration readTimeout) {
        return builder
            .setConnectTimeout(connectTimeout)
            .setReadTimeout(readTimeout)
            .build();
    }

    /**
     * Bounds how many accounts sync at once. Queued passes are drained on shutdown.
     */
    @Bean(name = "syncWorkers")
    public ThreadPoolTaskExecutor syncWorkers(@Value("${sync.workers:4}") int workers,
                                              @Value("${sync.queue-capacity:1000}") int queueCapacity,
                                              @Value("${sync.shutdown-timeout:PT5M}") Duration shutdownTimeout) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("sync-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) shutdownTimeout.toSeconds());
        executor.initialize();
        return executor;
    }

    // Provider fetches run here so a pass can be cut off at its time budget
    @Bean(name = "providerFetchExecutor")
    public AsyncTaskExecutor providerFetchExecutor(@Value("${sync.workers:4}") int workers) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers * 2);
        executor.setQueueCapacity(workers * 2);
        executor.setThreadNamePrefix("provider-fetch-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "syncRetryScheduler")
    public ThreadPoolTaskScheduler syncRetryScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("sync-retry-");
        scheduler.initialize();
        return scheduler;
    }
}
