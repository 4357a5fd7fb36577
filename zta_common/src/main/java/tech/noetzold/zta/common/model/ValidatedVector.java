package tech.noetzold.zta.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output of the signal validator: the original bundle, the per-signal confidence
 * weights and the ordered, duplicate-free list of anomaly reasons.
 */
public record ValidatedVector(
        SignalBundle vector,
        Map<String, Double> weights,
        List<AnomalyReason> reasons
) {

    public ValidatedVector {
        if (vector == null) {
            vector = new SignalBundle(null, Map.of(), null);
        }
        Set<SignalType> observed = vector.observedTypes();
        Map<String, Double> w = new LinkedHashMap<>();
        if (weights != null) {
            weights.forEach((k, v) -> {
                SignalType t = SignalType.fromKey(k)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown signal type in weights: " + k));
                if (!observed.contains(t)) {
                    throw new IllegalArgumentException("Weight given for unobserved signal: " + k);
                }
                if (v == null || v.isNaN() || v < 0.0 || v > 1.0) {
                    throw new IllegalArgumentException("Weight out of [0,1] for " + k + ": " + v);
                }
                w.put(t.key(), v);
            });
        }
        weights = Collections.unmodifiableMap(w);
        reasons = reasons == null
                ? List.of()
                : List.copyOf(new LinkedHashSet<>(reasons));
    }

    @JsonIgnore
    public String sessionId() {
        return vector.sessionId();
    }

    /** Weight for the type, 0 when it was not observed or failed quality checks. */
    public double weightOf(SignalType type) {
        Double w = weights.get(type.key());
        return w == null ? 0.0 : w;
    }

    public ValidatedVector withReason(AnomalyReason reason) {
        List<AnomalyReason> more = new ArrayList<>(reasons);
        more.add(reason);
        return new ValidatedVector(vector, weights, more);
    }
}
