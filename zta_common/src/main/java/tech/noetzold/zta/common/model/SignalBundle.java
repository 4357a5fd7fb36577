package tech.noetzold.zta.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Raw evidence collected for one authentication attempt, keyed by signal type.
 * Instances are immutable; the maps handed in are copied.
 * <p>
 * A recognised signal key whose value is not a JSON object is kept as a payload holding
 * only {@link #UNREADABLE_VALUE}, so the signal stays observed and is reported as malformed.
 */
public record SignalBundle(
        @JsonProperty("session_id") String sessionId,
        Map<String, Map<String, Object>> signals,
        String label
) {

    /** Payload key carrying the text of a signal value that was not an object. */
    public static final String UNREADABLE_VALUE = "_unreadable";

    public SignalBundle {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        if (signals != null) {
            signals.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, Collections.unmodifiableMap(new LinkedHashMap<>(v)));
                }
            });
        }
        signals = Collections.unmodifiableMap(copy);
        label = (label == null || label.isBlank()) ? null : label.trim();
    }

    /**
     * JSON entry point. Signal values of any shape are accepted so a bad value never
     * fails the whole request.
     */
    @JsonCreator
    public static SignalBundle fromJson(@JsonProperty("session_id") String sessionId,
                                        @JsonProperty("signals") Map<String, Object> signals,
                                        @JsonProperty("label") String label) {
        return new SignalBundle(sessionId, lenientSignals(signals), label);
    }

    /**
     * Builds a bundle from the flat shape older clients post, where
     * {@code session_id} and {@code label} sit next to the signal objects.
     */
    public static SignalBundle fromFlat(Map<String, Object> raw) {
        if (raw == null) {
            return new SignalBundle(null, Map.of(), null);
        }
        Object sid = raw.get("session_id");
        Object lab = raw.get("label");
        return new SignalBundle(
                sid instanceof String s ? s : null,
                lenientSignals(raw),
                lab instanceof String l ? l : null
        );
    }

    /** True when the payload stands for a value that was not an object. */
    public static boolean isUnreadable(Map<String, Object> payload) {
        return payload != null && payload.containsKey(UNREADABLE_VALUE);
    }

    /**
     * Objects are kept under any key. Other values are kept only under recognised signal
     * keys: null as an empty payload, anything else as an unreadable marker.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Map<String, Object>> lenientSignals(Map<String, Object> raw) {
        Map<String, Map<String, Object>> sigs = new LinkedHashMap<>();
        if (raw == null) {
            return sigs;
        }
        raw.forEach((k, v) -> {
            if (v instanceof Map<?, ?> m) {
                sigs.put(k, (Map<String, Object>) m);
            } else if (SignalType.fromKey(k).isPresent()) {
                sigs.put(k, v == null ? Map.of() : Map.of(UNREADABLE_VALUE, String.valueOf(v)));
            }
        });
        return sigs;
    }

    /** Payload for the given type, looked up under its key and aliases. */
    public Optional<Map<String, Object>> signal(SignalType type) {
        Map<String, Object> v = signals.get(type.key());
        if (v != null) return Optional.of(v);
        for (String alias : type.aliases()) {
            v = signals.get(alias);
            if (v != null) return Optional.of(v);
        }
        return Optional.empty();
    }

    @JsonIgnore
    public Set<SignalType> observedTypes() {
        Set<SignalType> out = EnumSet.noneOf(SignalType.class);
        for (String k : signals.keySet()) {
            SignalType.fromKey(k).ifPresent(out::add);
        }
        return out;
    }

    /** True when there is neither a recognised signal nor a label. */
    @JsonIgnore
    public boolean hasNoEvidence() {
        return observedTypes().isEmpty() && label == null;
    }

    public SignalBundle withSessionId(String newSessionId) {
        return new SignalBundle(newSessionId, signals, label);
    }
}
