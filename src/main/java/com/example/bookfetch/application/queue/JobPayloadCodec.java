package com.example.bookfetch.application.queue;

import com.example.bookfetch.common.exception.NonRetryableJobException;
import com.example.bookfetch.domain.enumtype.JobType;
import com.example.bookfetch.domain.payload.JobPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * JSON form of payloads and results as stored in the job ledger.
 */
@Component
public class JobPayloadCodec {

    private final ObjectMapper objectMapper;

    public JobPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(JobPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + payload.jobType().getCode() + " payload", e);
        }
    }

    public JobPayload decode(JobType type, String json) {
        try {
            return objectMapper.readValue(json, type.getPayloadType());
        } catch (JsonProcessingException e) {
            throw new NonRetryableJobException("Unreadable " + type.getCode() + " payload: " + e.getOriginalMessage(), e);
        }
    }

    public <T> T read(String json, Class<T> valueType) {
        try {
            return objectMapper.readValue(json, valueType);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable " + valueType.getSimpleName() + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * @return JSON of {@code value}, or {@code null} for a {@code null} value
     */
    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
