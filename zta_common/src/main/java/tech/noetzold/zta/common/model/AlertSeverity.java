package tech.noetzold.zta.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** {@code critical} is folded into HIGH; blanks and unknown values become MEDIUM. */
    @JsonCreator
    public static AlertSeverity parse(String raw) {
        if (raw == null) return MEDIUM;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "high", "critical" -> HIGH;
            default -> MEDIUM;
        };
    }
}
