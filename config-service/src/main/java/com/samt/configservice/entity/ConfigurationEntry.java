package com.samt.configservice.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.samt.configservice.entity.converter.JsonNodeConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity representing one named configuration value.
 *
 * A key owns exactly one row for its whole life: deletion only flips
 * {@code active}, and the row keeps its version and change log.
 */
@Entity
@Table(name = "system_configurations")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigurationEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "config_key", nullable = false, unique = true, length = 100)
    private String configKey;

    @Convert(converter = JsonNodeConverter.class)
    @Column(name = "config_value", nullable = false, columnDefinition = "TEXT")
    private JsonNode configValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "config_type", nullable = false, length = 20)
    private ConfigKind kind;

    @Column(name = "config_category", nullable = false, length = 50)
    private String category;

    @Column(name = "description", length = 500)
    private String description;

    @Convert(converter = JsonNodeConverter.class)
    @Column(name = "validation_schema", columnDefinition = "TEXT")
    private JsonNode validationSchema;

    /**
     * Business version: 1 on create, +1 per committed update.
     */
    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "active", nullable = false)
    private boolean active;

    /**
     * JSON array of change events, most recent last, at most 50 entries.
     */
    @Column(name = "change_log", nullable = false, columnDefinition = "TEXT")
    private String changeLog;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Optimistic locking for writers that bypass the row lock
     */
    @Version
    @Column(name = "lock_version")
    private Long lockVersion;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.version == null) {
            this.version = 1;
        }
        if (this.changeLog == null) {
            this.changeLog = "[]";
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
