package com.makerhedge.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executor for alert delivery, so a slow notification relay never blocks the hedge loop. */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${hedge.async.core-pool-size:1}")
    private int corePoolSize;

    @Value("${hedge.async.max-pool-size:2}")
    private int maxPoolSize;

    @Value("${hedge.async.queue-capacity:200}")
    private int queueCapacity;

    @Bean("alertExecutor")
    public ThreadPoolTaskExecutor alertExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("alert-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return alertExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
