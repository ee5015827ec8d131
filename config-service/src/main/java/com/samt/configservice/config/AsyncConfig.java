package com.samt.configservice.config;

import com.samt.configservice.notify.DispatchLanes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for change notification delivery.
 *
 * Thread Pool Sizing (one lane per executor):
 * - Core/Max: 1 thread, so events hashed onto a lane are delivered in enqueue order
 * - Queue: unbounded, publishers never block on slow subscribers
 * - Lanes: {@code config.notify.dispatch-lanes} (default 4), keys spread by hash
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(destroyMethod = "shutdown")
    public DispatchLanes notificationDispatchLanes(
            @Value("${config.notify.dispatch-lanes:4}") int laneCount) {
        if (laneCount < 1) {
            throw new IllegalArgumentException("config.notify.dispatch-lanes must be positive: " + laneCount);
        }
        List<ThreadPoolTaskExecutor> lanes = new ArrayList<>(laneCount);
        for (int i = 0; i < laneCount; i++) {
            lanes.add(dispatchLane(i));
        }
        log.info("Initialized {} notification dispatch lanes (1 thread each, unbounded queue)", laneCount);
        return new DispatchLanes(lanes);
    }

    private ThreadPoolTaskExecutor dispatchLane(int index) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("notify-lane-" + index + "-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        // Correlation ID of the committing request follows the event
        executor.setTaskDecorator(new MdcTaskDecorator());

        // Flush pending notifications on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);

        executor.initialize();
        return executor;
    }
}
