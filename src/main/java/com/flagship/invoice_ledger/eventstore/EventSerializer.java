package com.flagship.invoice_ledger.eventstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoice_ledger.eventsourcing.exception.EventSerializationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON codec for event payloads and aggregate snapshots.
 */
@Component
@RequiredArgsConstructor
public class EventSerializer {

    private final ObjectMapper objectMapper;

    public String serialize(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                    "Failed to serialize " + payload.getClass().getSimpleName(), e);
        }
    }

    public <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                    "Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
