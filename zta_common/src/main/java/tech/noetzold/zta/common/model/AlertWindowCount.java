package tech.noetzold.zta.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * High and medium severity alerts seen for a session inside a trailing window.
 * Recomputed on every query.
 */
public record AlertWindowCount(
        @JsonProperty("session_id") String sessionId,
        long high,
        long medium,
        @JsonProperty("window_minutes") int windowMinutes
) {

    public AlertWindowCount {
        if (high < 0 || medium < 0) {
            throw new IllegalArgumentException("Alert counts must be non-negative");
        }
    }

    public static AlertWindowCount none(String sessionId, int windowMinutes) {
        return new AlertWindowCount(sessionId, 0, 0, windowMinutes);
    }
}
