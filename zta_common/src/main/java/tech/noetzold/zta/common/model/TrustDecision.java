package tech.noetzold.zta.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum TrustDecision {
    ALLOW,
    STEP_UP,
    DENY;

    @JsonCreator
    public static TrustDecision parse(String raw) {
        if (raw == null) throw new IllegalArgumentException("decision is required");
        return valueOf(raw.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
