package tech.noetzold.zta.validation_api.model;

import tech.noetzold.zta.common.model.SignalType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only annotations resolved from reference data for one bundle.
 * A signal type without an entry in {@code annotations} had nothing to resolve.
 */
public record EnrichmentResult(
        Map<SignalType, Map<String, Object>> annotations,
        List<ConsistencyCheck> checks
) {

    public EnrichmentResult {
        Map<SignalType, Map<String, Object>> copy = new EnumMap<>(SignalType.class);
        if (annotations != null) {
            annotations.forEach((k, v) -> copy.put(k, Collections.unmodifiableMap(new LinkedHashMap<>(v))));
        }
        annotations = Collections.unmodifiableMap(copy);
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public boolean resolved(SignalType type) {
        Map<String, Object> a = annotations.get(type);
        return a != null && !a.isEmpty();
    }

    public Map<String, Object> annotation(SignalType type) {
        return annotations.getOrDefault(type, Map.of());
    }

    /** Diagnostic view keyed by the wire names. */
    public Map<String, Object> toDiagnostics() {
        Map<String, Object> out = new LinkedHashMap<>();
        annotations.forEach((k, v) -> out.put(k.key(), v));
        if (!checks.isEmpty()) {
            out.put("checks", checks);
        }
        return out;
    }
}
