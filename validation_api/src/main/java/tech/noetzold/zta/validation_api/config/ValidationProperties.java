package tech.noetzold.zta.validation_api.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import tech.noetzold.zta.common.model.SignalType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "zta.validation")
public class ValidationProperties {

    private Reference reference = new Reference();
    private CrossCheck crossCheck = new CrossCheck();

    private Duration maxSignalAge = Duration.ofMinutes(5);
    private Duration maxClockSkew = Duration.ofMinutes(1);
    private Duration postureMaxAge = Duration.ofDays(30);

    private List<String> expectedSignals = new ArrayList<>(List.of("ip_origin"));

    private double mismatchWeightCap = 0.2;
    private double unresolvedPenalty = 0.5;

    /** Base confidence weight per signal type, keyed by wire name. */
    private Map<String, Double> weights = new LinkedHashMap<>(Map.of(
            "ip_origin", 0.70,
            "gps", 0.90,
            "wifi_ap", 0.80,
            "device_posture", 0.85,
            "tls_fingerprint", 0.60));

    private List<String> suspiciousTlsTags = new ArrayList<>(
            List.of("malicious", "malware", "botnet", "suspicious", "c2", "tor", "scanner"));

    private List<String> unhealthyEdrStates = new ArrayList<>(List.of("none", "disabled", "off", "missing"));

    @Data
    public static class Reference {
        private String geoip = "file:/data/geolite2/GeoLite2-City.mmdb";
        private String wifi = "classpath:reference/wifi_aps.csv";
        private String tls = "classpath:reference/ja3_fingerprints.csv";
        private String device = "classpath:reference/device_posture.csv";
    }

    @Data
    public static class CrossCheck {
        private double distanceThresholdKm = 50.0;
    }

    @PostConstruct
    public void validate() {
        if (crossCheck.distanceThresholdKm <= 0) {
            throw new IllegalStateException("zta.validation.cross-check.distance-threshold-km must be > 0");
        }
        requireUnit("mismatch-weight-cap", mismatchWeightCap);
        requireUnit("unresolved-penalty", unresolvedPenalty);
        if (maxSignalAge == null || maxSignalAge.isNegative() || maxSignalAge.isZero()) {
            throw new IllegalStateException("zta.validation.max-signal-age must be positive");
        }
        if (maxClockSkew == null || maxClockSkew.isNegative()) {
            throw new IllegalStateException("zta.validation.max-clock-skew must not be negative");
        }
        if (postureMaxAge == null || postureMaxAge.isNegative() || postureMaxAge.isZero()) {
            throw new IllegalStateException("zta.validation.posture-max-age must be positive");
        }
        baseWeights();
        expectedTypes();
    }

    /**
     * Weight table resolved to signal types. Types without a configured value get 0.
     * Map keys are matched leniently because relaxed binding may strip separators.
     */
    public Map<SignalType, Double> baseWeights() {
        Map<SignalType, Double> out = new EnumMap<>(SignalType.class);
        for (SignalType t : SignalType.values()) {
            out.put(t, 0.0);
        }
        weights.forEach((k, v) -> {
            SignalType t = lenientType(k);
            requireUnit("weights." + k, v == null ? Double.NaN : v);
            out.put(t, v);
        });
        return out;
    }

    public Set<SignalType> expectedTypes() {
        Set<SignalType> out = EnumSet.noneOf(SignalType.class);
        for (String k : expectedSignals) {
            out.add(lenientType(k));
        }
        return out;
    }

    private static SignalType lenientType(String key) {
        String k = squash(key);
        for (SignalType t : SignalType.values()) {
            if (squash(t.key()).equals(k)) return t;
            for (String a : t.aliases()) {
                if (squash(a).equals(k)) return t;
            }
        }
        throw new IllegalStateException("Unknown signal type in zta.validation configuration: " + key);
    }

    private static String squash(String s) {
        return s == null ? "" : s.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }

    private static void requireUnit(String name, double v) {
        if (Double.isNaN(v) || v < 0.0 || v > 1.0) {
            throw new IllegalStateException("zta.validation." + name + " must be within [0,1], got " + v);
        }
    }
}
