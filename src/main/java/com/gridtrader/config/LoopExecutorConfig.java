package com.gridtrader.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for the four monitoring loops. Each loop occupies one thread for as long as the bot
 * runs, so the pool is sized exactly to the loop count with no queue.
 */
@Configuration
public class LoopExecutorConfig {

    public static final int LOOP_COUNT = 4;

    @Bean("loopExecutor")
    public ThreadPoolTaskExecutor loopExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(LOOP_COUNT);
        executor.setMaxPoolSize(LOOP_COUNT);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("grid-loop-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
