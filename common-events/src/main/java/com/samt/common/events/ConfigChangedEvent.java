package com.samt.common.events;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Config Changed Event
 *
 * Published by: Config Service after a configuration mutation commits
 * Consumed by: every subscriber registered for the changed key
 * (WebSocket clients of /ws/config)
 *
 * Event Flow:
 * 1. Config Service commits create/update/delete/restore of a key
 * 2. Cache entry for the key is invalidated
 * 3. Event is enqueued on the dispatch lane owning the key
 * 4. Lane delivers the event to each subscriber of the key, in commit order
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigChangedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Wire message type understood by subscribers.
     */
    public static final String TYPE = "config_changed";

    @Builder.Default
    private String type = TYPE;

    /**
     * Event ID (UUID) to deduplicate
     */
    private String eventId;

    /**
     * Configuration key that changed
     */
    private String key;

    /**
     * Value after the change; null for DELETE
     */
    private JsonNode value;

    private ChangeAction action;

    private Instant timestamp;
}
