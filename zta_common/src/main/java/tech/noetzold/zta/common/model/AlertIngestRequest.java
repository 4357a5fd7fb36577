package tech.noetzold.zta.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A security alert handed to the alert store.
 */
public record AlertIngestRequest(
        @JsonProperty("session_id") String sessionId,
        AlertSeverity severity,
        StrideCategory stride,
        String source,
        Map<String, Object> raw
) {}
