package com.samt.configservice.config;

import com.samt.configservice.cache.ConfigCache;
import com.samt.configservice.notify.ChangeBus;
import com.samt.configservice.notify.DispatchLanes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared in-process state of the service: the entry cache and the subscription registry.
 */
@Configuration
@Slf4j
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConfigCache configCache(
            @Value("${config.cache.max-size:1000}") int maxSize,
            Clock clock) {
        log.info("Config cache: maxSize={}", maxSize);
        return new ConfigCache(maxSize, clock);
    }

    @Bean
    public ChangeBus changeBus(DispatchLanes notificationDispatchLanes, Clock clock) {
        return new ChangeBus(notificationDispatchLanes, clock);
    }
}
