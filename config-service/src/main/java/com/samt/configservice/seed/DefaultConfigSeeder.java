package com.samt.configservice.seed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.samt.configservice.entity.ConfigKind;
import com.samt.configservice.exception.ConfigAlreadyExistsException;
import com.samt.configservice.service.ConfigEngine;
import com.samt.configservice.service.CreateConfigCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Creates the platform's default entries at startup when they do not exist yet.
 *
 * Existing entries, active or retired, are left untouched. A default that
 * fails its own schema aborts startup.
 */
@Component
@ConditionalOnProperty(name = "config.seed.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DefaultConfigSeeder implements ApplicationRunner {

    static final String SEED_RESOURCE = "seed/default-configs.json";
    static final String SEED_ACTOR = "system";

    private final ConfigEngine engine;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        seed();
    }

    /**
     * @return number of entries created
     */
    public int seed() throws IOException {
        List<SeedEntry> entries = loadSeedEntries();

        int created = 0;
        for (SeedEntry entry : entries) {
            try {
                engine.createConfig(CreateConfigCommand.builder()
                    .key(entry.key())
                    .value(entry.value())
                    .kind(entry.kind())
                    .category(entry.category())
                    .description(entry.description())
                    .validationSchema(entry.validationSchema())
                    .actor(SEED_ACTOR)
                    .build());
                created++;
            } catch (ConfigAlreadyExistsException e) {
                log.debug("Default config {} already present, skipping", entry.key());
            }
        }

        log.info("Default configs: {} created, {} already present", created, entries.size() - created);
        return created;
    }

    private List<SeedEntry> loadSeedEntries() throws IOException {
        try (InputStream in = new ClassPathResource(SEED_RESOURCE).getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<SeedEntry>>() {});
        }
    }

    record SeedEntry(
        String key,
        JsonNode value,
        ConfigKind kind,
        String category,
        String description,
        JsonNode validationSchema
    ) {
    }
}
