package com.samt.configservice.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the JSON change log kept in each entry row.
 */
@Component
@RequiredArgsConstructor
public class ChangeHistoryCodec {

    public static final int MAX_ENTRIES = 50;

    private static final TypeReference<List<ChangeEvent>> EVENT_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public List<ChangeEvent> read(String changeLog) throws JsonProcessingException {
        if (changeLog == null || changeLog.isBlank()) {
            return List.of();
        }
        return objectMapper.readValue(changeLog, EVENT_LIST);
    }

    /**
     * Append an event, keeping only the {@value #MAX_ENTRIES} most recent ones.
     */
    public String append(String changeLog, ChangeEvent event) throws JsonProcessingException {
        List<ChangeEvent> events = new ArrayList<>(read(changeLog));
        events.add(event);
        if (events.size() > MAX_ENTRIES) {
            events = events.subList(events.size() - MAX_ENTRIES, events.size());
        }
        return objectMapper.writeValueAsString(events);
    }
}
