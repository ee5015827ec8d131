package com.samt.configservice.config;

import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;

/**
 * TaskDecorator to propagate MDC (Mapped Diagnostic Context) to dispatch lane threads.
 *
 * The correlation ID of the request that committed a change is captured when
 * the notification is enqueued and restored on the lane thread while the event
 * is delivered, so delivery logs can be joined with the originating request.
 *
 * Lane threads are long-lived: the previous worker context is restored (or
 * cleared) after each task.
 */
public class MdcTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        // Runs on the publishing thread
        Map<String, String> publisherContext = MDC.getCopyOfContextMap();

        return () -> {
            Map<String, String> previousContext = MDC.getCopyOfContextMap();
            try {
                if (publisherContext != null) {
                    MDC.setContextMap(publisherContext);
                } else {
                    MDC.clear();
                }
                runnable.run();
            } finally {
                if (previousContext != null) {
                    MDC.setContextMap(previousContext);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
