package com.samt.configservice.exception;

/**
 * Failure to deliver a change event to one subscriber.
 * Only logged; never propagated to the publisher.
 */
public class NotificationDeliveryException extends RuntimeException {

    public NotificationDeliveryException(String subscriberId, String key, Throwable cause) {
        super("Failed to notify subscriber " + subscriberId + " of change to " + key + ": " + cause.getMessage(), cause);
    }
}
