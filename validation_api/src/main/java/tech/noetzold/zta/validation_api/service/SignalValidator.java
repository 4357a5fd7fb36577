package tech.noetzold.zta.validation_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.zta.common.model.AnomalyReason;
import tech.noetzold.zta.common.model.SignalBundle;
import tech.noetzold.zta.common.model.SignalType;
import tech.noetzold.zta.common.model.ValidatedVector;
import tech.noetzold.zta.validation_api.config.ValidationProperties;
import tech.noetzold.zta.validation_api.model.ConsistencyCheck;
import tech.noetzold.zta.validation_api.model.EnrichmentResult;
import tech.noetzold.zta.validation_api.model.SignalQuality;
import tech.noetzold.zta.validation_api.model.ValidationOutcome;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a raw bundle and its enrichment into a weighted, annotated vector.
 * <p>
 * Steps run in a fixed order: quality, cross-check, weighting, content findings, threat label.
 * A signal that fails quality keeps its key with weight 0. A failed cross-check caps the
 * weights of the signals involved instead of zeroing them. Weights are never renormalised.
 * Input defects never raise; they become reasons.
 */
@Slf4j
@Service
public class SignalValidator {

    private final ValidationProperties props;
    private final SignalQualityChecker qualityChecker;
    private final ThreatLabelClassifier labelClassifier;
    private final Clock clock;

    public SignalValidator(ValidationProperties props,
                           SignalQualityChecker qualityChecker,
                           ThreatLabelClassifier labelClassifier,
                           Clock clock) {
        this.props = props;
        this.qualityChecker = qualityChecker;
        this.labelClassifier = labelClassifier;
        this.clock = clock;
    }

    public ValidatedVector validate(SignalBundle bundle, EnrichmentResult enrichment) {
        return assess(bundle, enrichment).validated();
    }

    public ValidationOutcome assess(SignalBundle bundle, EnrichmentResult enrichment) {
        List<AnomalyReason> reasons = new ArrayList<>();
        Set<SignalType> observed = bundle.observedTypes();

        if (observed.isEmpty()) {
            reasons.add(AnomalyReason.INSUFFICIENT_SIGNAL);
            reasons.addAll(labelClassifier.classify(bundle.label()));
            return new ValidationOutcome(new ValidatedVector(bundle, Map.of(), reasons), Map.of());
        }

        // 1. quality
        Map<SignalType, SignalQuality> quality = new EnumMap<>(SignalType.class);
        for (SignalType t : observed) {
            SignalQuality q = qualityChecker.check(t, bundle.signal(t).orElse(Map.of()));
            quality.put(t, q);
            if (!q.present()) {
                reasons.add(AnomalyReason.SIGNAL_MISSING);
            } else if (!q.wellFormed()) {
                reasons.add(AnomalyReason.SIGNAL_MALFORMED);
            } else if (!q.fresh()) {
                reasons.add(AnomalyReason.SIGNAL_STALE);
            }
        }
        for (SignalType expected : props.expectedTypes()) {
            if (!observed.contains(expected)) {
                reasons.add(AnomalyReason.SIGNAL_MISSING);
            }
        }

        // 2. cross-check
        Map<SignalType, Double> caps = new EnumMap<>(SignalType.class);
        for (ConsistencyCheck check : enrichment.checks()) {
            // a location from a signal that failed quality is not evidence of a mismatch
            boolean trusted = check.subjects().stream().allMatch(subject -> passed(quality, subject));
            if (!check.exceeded() || !trusted) continue;
            reasons.add(AnomalyReason.LOCATION_MISMATCH);
            for (SignalType subject : check.subjects()) {
                caps.put(subject, props.getMismatchWeightCap());
            }
            log.info("Location mismatch session={} metric={} value={} threshold={}",
                    bundle.sessionId(), check.metricName(), check.value(), check.threshold());
        }

        // 3. weights
        Map<SignalType, Double> base = props.baseWeights();
        Map<String, Double> weights = new LinkedHashMap<>();
        for (SignalType t : observed) {
            double w = 0.0;
            if (passed(quality, t)) {
                w = base.get(t);
                if (hasReferenceLookup(t) && !enrichment.resolved(t)) {
                    w *= props.getUnresolvedPenalty();
                }
                Double cap = caps.get(t);
                if (cap != null) {
                    w = Math.min(w, cap);
                }
            }
            weights.put(t.key(), clamp01(w));
        }

        // 4. content findings
        if (passed(quality, SignalType.TLS_FINGERPRINT) && suspiciousTls(enrichment)) {
            reasons.add(AnomalyReason.TLS_ANOMALY);
        }
        if (passed(quality, SignalType.DEVICE_POSTURE)) {
            Map<String, Object> payload = bundle.signal(SignalType.DEVICE_POSTURE).orElse(Map.of());
            Map<String, Object> ref = enrichment.annotation(SignalType.DEVICE_POSTURE);
            if (postureOutdated(payload, ref)) {
                reasons.add(AnomalyReason.POSTURE_OUTDATED);
            }
            if (edrUnhealthy(payload, ref)) {
                reasons.add(AnomalyReason.DEVICE_UNHEALTHY);
            }
        }

        // 5. threat label
        reasons.addAll(labelClassifier.classify(bundle.label()));

        ValidatedVector vector = new ValidatedVector(bundle, weights, reasons);
        log.info("Validated session={} weights={} reasons={}", bundle.sessionId(), vector.weights(), vector.reasons());
        return new ValidationOutcome(vector, quality);
    }

    private static boolean passed(Map<SignalType, SignalQuality> quality, SignalType t) {
        SignalQuality q = quality.get(t);
        return q != null && q.passed();
    }

    private static boolean hasReferenceLookup(SignalType t) {
        return t != SignalType.GPS;
    }

    private boolean suspiciousTls(EnrichmentResult enrichment) {
        Object tag = enrichment.annotation(SignalType.TLS_FINGERPRINT).get("tag");
        if (tag == null) return false;
        Set<String> suspicious = props.getSuspiciousTlsTags().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        for (String token : tag.toString().toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (suspicious.contains(token)) return true;
        }
        return false;
    }

    private boolean postureOutdated(Map<String, Object> payload, Map<String, Object> ref) {
        Optional<Boolean> patched = SignalPayloads.bool(payload, "patched")
                .or(() -> SignalPayloads.bool(ref, "patched"));
        if (patched.isPresent() && !patched.get()) {
            return true;
        }
        Object lastUpdate = payload.containsKey("last_update") ? payload.get("last_update") : ref.get("last_update");
        try {
            Optional<Instant> at = SignalPayloads.instant(lastUpdate);
            return at.isPresent() && at.get().plus(props.getPostureMaxAge()).isBefore(clock.instant());
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unreadable posture last_update {}", lastUpdate);
            return false;
        }
    }

    private boolean edrUnhealthy(Map<String, Object> payload, Map<String, Object> ref) {
        Optional<String> edr = SignalPayloads.text(payload, "edr").or(() -> SignalPayloads.text(ref, "edr"));
        return edr.map(e -> props.getUnhealthyEdrStates().stream().anyMatch(s -> s.equalsIgnoreCase(e)))
                .orElse(false);
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
