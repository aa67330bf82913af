package com.github.feedflow.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ExecutorConfig {

    /**
     * Drains stdout/stderr of extraction subprocesses so the caller can enforce
     * a wall-clock timeout instead of blocking on a pipe read.
     */
    @Bean(name = "processIoExecutor")
    public ThreadPoolTaskExecutor processIoExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("extract-io-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Writes proxied media bodies to clients (MVC async support).
     */
    @Bean(name = "proxyStreamExecutor")
    public ThreadPoolTaskExecutor proxyStreamExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(16);
        executor.setMaxPoolSize(256);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("proxy-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
