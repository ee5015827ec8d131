package com.samt.configservice.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.retry.event.RetryOnErrorEvent;
import io.github.resilience4j.retry.event.RetryOnRetryEvent;
import io.github.resilience4j.retry.event.RetryOnSuccessEvent;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

/**
 * Logs what the storeRead retry does with failed store reads.
 *
 * RETRY_ATTEMPT (WARN) before each new attempt, RETRY_SUCCESS (INFO) when a
 * read succeeded after at least one retry, RETRY_EXHAUSTED (WARN) when the
 * last attempt failed too. Exceptions outside {@code retry-exceptions}
 * (not found, validation) are not retried and only logged at DEBUG.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RetryEventConfig {

    private static final String STORE_READ_RETRY = "storeRead";

    private final RetryRegistry retryRegistry;

    @PostConstruct
    public void configureRetryEventLogging() {
        Retry storeRead = retryRegistry.retry(STORE_READ_RETRY);
        storeRead.getEventPublisher()
            .onRetry(this::logRetryAttempt)
            .onSuccess(this::logRetrySuccess)
            .onError(this::logRetryExhausted)
            .onIgnoredError(event -> log.debug("RETRY_SKIPPED name={} error={}",
                event.getName(), event.getLastThrowable().getClass().getSimpleName()));

        log.info("Store read retry: maxAttempts={}", storeRead.getRetryConfig().getMaxAttempts());
    }

    private void logRetryAttempt(RetryOnRetryEvent event) {
        log.warn("RETRY_ATTEMPT name={} attempt={} wait={}ms error={}",
            event.getName(),
            event.getNumberOfRetryAttempts(),
            event.getWaitInterval().toMillis(),
            event.getLastThrowable().getMessage());
    }

    private void logRetrySuccess(RetryOnSuccessEvent event) {
        if (event.getNumberOfRetryAttempts() > 0) {
            log.info("RETRY_SUCCESS name={} retries={}", event.getName(), event.getNumberOfRetryAttempts());
        }
    }

    private void logRetryExhausted(RetryOnErrorEvent event) {
        log.warn("RETRY_EXHAUSTED name={} attempts={} error={}",
            event.getName(),
            event.getNumberOfRetryAttempts(),
            event.getLastThrowable().getMessage());
    }
}
