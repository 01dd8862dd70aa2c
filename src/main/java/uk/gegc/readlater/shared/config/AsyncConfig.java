package uk.gegc.readlater.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool used for post-commit work such as library item change notifications.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.general.core-pool-size:2}")
    private int generalCorePoolSize;

    @Value("${async.general.max-pool-size:4}")
    private int generalMaxPoolSize;

    @Value("${async.general.queue-capacity:100}")
    private int generalQueueCapacity;

    @Value("${async.general.keep-alive-seconds:60}")
    private int generalKeepAliveSeconds;

    @Bean(name = "generalTaskExecutor")
    public Executor generalTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(generalCorePoolSize);
        executor.setMaxPoolSize(generalMaxPoolSize);
        executor.setQueueCapacity(generalQueueCapacity);
        executor.setKeepAliveSeconds(generalKeepAliveSeconds);
        executor.setThreadNamePrefix("general-");
        // Notifications are best-effort; when saturated, run them on the publishing thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("General task executor initialized: core={}, max={}, queue={}",
                generalCorePoolSize, generalMaxPoolSize, generalQueueCapacity);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return generalTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) ->
                log.error("Uncaught async exception in {}: {}", method.getName(), ex.getMessage(), ex);
    }
}
