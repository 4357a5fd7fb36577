package tech.noetzold.zta.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * STRIDE threat taxonomy used to classify why a session was flagged.
 */
public enum StrideCategory {

    SPOOFING("Spoofing"),
    TAMPERING("Tampering"),
    REPUDIATION("Repudiation"),
    INFORMATION_DISCLOSURE("InformationDisclosure"),
    DENIAL_OF_SERVICE("DoS"),
    ELEVATION_OF_PRIVILEGE("EoP");

    private final String label;

    StrideCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Lenient parse: case, spaces, dashes and underscores are ignored, and both the
     * short label ({@code DoS}) and the enum name ({@code DENIAL_OF_SERVICE}) match.
     * Anything unrecognised falls back to {@link #INFORMATION_DISCLOSURE}.
     */
    @JsonCreator
    public static StrideCategory parse(String raw) {
        String k = squash(raw);
        for (StrideCategory c : values()) {
            if (squash(c.label).equals(k) || squash(c.name()).equals(k)) {
                return c;
            }
        }
        return INFORMATION_DISCLOSURE;
    }

    private static String squash(String s) {
        if (s == null) return "";
        return s.replace("_", "").replace("-", "").replace(" ", "").toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return label;
    }
}
