package tech.noetzold.zta.validation_api.model;

import tech.noetzold.zta.common.model.SignalType;
import tech.noetzold.zta.common.model.ValidatedVector;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Validated vector plus the per-signal quality verdicts that produced it.
 */
public record ValidationOutcome(ValidatedVector validated, Map<SignalType, SignalQuality> quality) {

    public ValidationOutcome {
        Map<SignalType, SignalQuality> copy = new EnumMap<>(SignalType.class);
        if (quality != null) copy.putAll(quality);
        quality = Collections.unmodifiableMap(copy);
    }
}
