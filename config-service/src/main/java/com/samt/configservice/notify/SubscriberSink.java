package com.samt.configservice.notify;

import com.samt.common.events.ConfigChangedEvent;

import java.io.IOException;

/**
 * Outbound side of one subscriber connection.
 */
public interface SubscriberSink {

    boolean isOpen();

    void send(ConfigChangedEvent event) throws IOException;
}
