package tech.noetzold.zta.trust_api.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import tech.noetzold.zta.common.model.AnomalyReason;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Scoring constants. Every value is checked once at startup and a bad
 * combination stops the service from serving traffic.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "zta.trust")
public class TrustProperties {

    private double baseRisk = 0.05;

    private double allowThreshold = 0.12;
    private double denyThreshold = 0.80;

    private double siemHighBump = 0.20;
    private double siemMediumBump = 0.08;

    /** Sum of weights that counts as a fully evidenced vector. */
    private double fullWeightMass = 3.0;

    private double highConfidence = 0.85;
    private double lowConfidence = 0.50;
    private double highConfidenceFactor = 0.85;
    private double lowConfidenceFactor = 1.10;

    /** Overrides of the per-reason default increment, keyed by reason name. */
    private Map<String, Double> reasonIncrements = new LinkedHashMap<>();

    @PostConstruct
    public void validate() {
        within("base-risk", baseRisk, 0.0, 1.0);
        within("allow-threshold", allowThreshold, 0.0, 1.0);
        within("deny-threshold", denyThreshold, 0.0, 1.0);
        if (allowThreshold >= denyThreshold) {
            throw new IllegalStateException("zta.trust.allow-threshold (" + allowThreshold
                    + ") must be below zta.trust.deny-threshold (" + denyThreshold + ")");
        }
        within("siem-high-bump", siemHighBump, 0.0, 1.0);
        within("siem-medium-bump", siemMediumBump, 0.0, 1.0);
        if (!(fullWeightMass > 0.0)) {
            throw new IllegalStateException("zta.trust.full-weight-mass must be > 0");
        }
        within("high-confidence", highConfidence, 0.0, 1.0);
        within("low-confidence", lowConfidence, 0.0, 1.0);
        if (lowConfidence >= highConfidence) {
            throw new IllegalStateException("zta.trust.low-confidence must be below zta.trust.high-confidence");
        }
        within("high-confidence-factor", highConfidenceFactor, 0.5, 1.0);
        within("low-confidence-factor", lowConfidenceFactor, 1.0, 1.5);
        increments();
    }

    /** Effective increment per reason: defaults overlaid with configured overrides. */
    public Map<AnomalyReason, Double> increments() {
        Map<AnomalyReason, Double> out = new EnumMap<>(AnomalyReason.class);
        for (AnomalyReason r : AnomalyReason.values()) {
            out.put(r, r.defaultIncrement());
        }
        reasonIncrements.forEach((k, v) -> {
            AnomalyReason r = lenientReason(k);
            within("reason-increments." + k, v == null ? Double.NaN : v, 0.0, 1.0);
            out.put(r, v);
        });
        return out;
    }

    private static AnomalyReason lenientReason(String key) {
        String k = squash(key);
        for (AnomalyReason r : AnomalyReason.values()) {
            if (squash(r.name()).equals(k)) return r;
        }
        throw new IllegalStateException("Unknown anomaly reason in zta.trust.reason-increments: " + key);
    }

    private static String squash(String s) {
        return s == null ? "" : s.replace("_", "").replace("-", "").toUpperCase(Locale.ROOT);
    }

    private static void within(String name, double v, double min, double max) {
        if (Double.isNaN(v) || v < min || v > max) {
            throw new IllegalStateException("zta.trust." + name + " must be within [" + min + "," + max + "], got " + v);
        }
    }
}
