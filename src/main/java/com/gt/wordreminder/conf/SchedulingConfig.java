package com.gt.wordreminder.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Scheduler shared by the reminder loop and the session sweepers. On shutdown it stops starting new ticks,
 * gives running ticks a bounded time to finish and then interrupts them.
 */
@Configuration
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    public ThreadPoolTaskScheduler taskScheduler(@Value("${wordreminder.scheduler.poolSize:3}") int poolSize,
                                                 @Value("${wordreminder.scheduler.shutdownAwaitSeconds:30}") int shutdownAwaitSeconds) {
        ThreadPoolTaskScheduler taskScheduler = new ThreadPoolTaskScheduler() {
            @Override
            public void shutdown() {
                super.shutdown();

                ScheduledExecutorService executor = getScheduledExecutor();
                if (!executor.isTerminated()) {
                    log.warn("Scheduled tasks still running after {} seconds. Interrupting.", shutdownAwaitSeconds);
                    executor.shutdownNow();
                }
            }
        };

        taskScheduler.setPoolSize(poolSize);
        taskScheduler.setThreadNamePrefix("wordreminder-task-");
        taskScheduler.setWaitForTasksToCompleteOnShutdown(true);
        taskScheduler.setAwaitTerminationSeconds(shutdownAwaitSeconds);

        return taskScheduler;
    }
}
