package tech.noetzold.zta.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of contextual evidence an authentication attempt can carry.
 * <p>
 * The wire key is the lower snake case name. Older clients still send
 * {@code ip_geo}, {@code wifi_bssid} and {@code tls_fp}; those are accepted as aliases.
 */
public enum SignalType {

    IP_ORIGIN("ip_origin", "ip_geo"),
    GPS("gps"),
    WIFI_AP("wifi_ap", "wifi_bssid"),
    DEVICE_POSTURE("device_posture"),
    TLS_FINGERPRINT("tls_fingerprint", "tls_fp");

    private final String key;
    private final List<String> aliases;

    SignalType(String key, String... aliases) {
        this.key = key;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String key() {
        return key;
    }

    public List<String> aliases() {
        return aliases;
    }

    public static Optional<SignalType> fromKey(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String k = raw.trim().toLowerCase(Locale.ROOT);
        for (SignalType t : values()) {
            if (t.key.equals(k) || t.aliases.contains(k)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static SignalType of(String raw) {
        return fromKey(raw).orElseThrow(() -> new IllegalArgumentException("Unknown signal type: " + raw));
    }

    @Override
    public String toString() {
        return key;
    }
}
