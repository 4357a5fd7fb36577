package tech.noetzold.zta.validation_api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.noetzold.zta.common.model.AnomalyReason;
import tech.noetzold.zta.common.model.SignalBundle;
import tech.noetzold.zta.common.model.SignalType;
import tech.noetzold.zta.common.model.ValidatedVector;
import tech.noetzold.zta.validation_api.ValidationFixtures;
import tech.noetzold.zta.validation_api.config.ValidationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalValidatorTest {

    private SignalEnrichmentResolver resolver;
    private SignalValidator validator;

    @BeforeEach
    void setUp() {
        ValidationProperties props = ValidationFixtures.properties();
        resolver = new SignalEnrichmentResolver(ValidationFixtures.holder(props), props);
        validator = new SignalValidator(props,
                new SignalQualityChecker(props, ValidationFixtures.CLOCK),
                new ThreatLabelClassifier(),
                ValidationFixtures.CLOCK);
    }

    private ValidatedVector validate(SignalBundle bundle) {
        return validator.validate(bundle, resolver.enrich(bundle));
    }

    @Test
    @DisplayName("An empty bundle yields no weights and a single insufficient-signal reason")
    void emptyBundle() {
        ValidatedVector v = validate(new SignalBundle("s1", Map.of(), null));

        assertTrue(v.weights().isEmpty());
        assertEquals(List.of(AnomalyReason.INSUFFICIENT_SIGNAL), v.reasons());
    }

    @Test
    @DisplayName("A label without signals keeps the label reasons after insufficient-signal")
    void labelOnly() {
        ValidatedVector v = validate(new SignalBundle("s1", Map.of(), "DDoS"));

        assertTrue(v.weights().isEmpty());
        assertEquals(List.of(AnomalyReason.INSUFFICIENT_SIGNAL, AnomalyReason.DENIAL_OF_SERVICE), v.reasons());
    }

    @Test
    @DisplayName("Clean resolved signals get their base weights and no reasons")
    void cleanSignals() {
        ValidatedVector v = validate(new SignalBundle("s1", Map.of(
                "ip_origin", Map.of("ip", "81.2.69.160"),
                "gps", Map.of("lat", 51.5074, "lon", -0.1278),
                "wifi_ap", Map.of("bssid", "aa:bb:cc:dd:ee:03"),
                "device_posture", Map.of("device_id", "dev-001"),
                "tls_fingerprint", Map.of("ja3", "771f2b1b1e6b6c1d9a5e7a3b4c5d6e7f")), "BENIGN"));

        assertTrue(v.reasons().isEmpty(), () -> "unexpected " + v.reasons());
        assertEquals(0.70, v.weightOf(SignalType.IP_ORIGIN), 1e-9);
        assertEquals(0.90, v.weightOf(SignalType.GPS), 1e-9);
        assertEquals(0.80, v.weightOf(SignalType.WIFI_AP), 1e-9);
        assertEquals(0.85, v.weightOf(SignalType.DEVICE_POSTURE), 1e-9);
        assertEquals(0.60, v.weightOf(SignalType.TLS_FINGERPRINT), 1e-9);
    }

    @Test
    @DisplayName("A location mismatch caps the location weights instead of zeroing them")
    void locationMismatchCaps() {
        ValidatedVector v = validate(new SignalBundle("s1", Map.of(
                "gps", Map.of("lat", -22.9068, "lon", -43.1729),
                "wifi_ap", Map.of("bssid", "aa:bb:cc:dd:ee:01"),
                "ip_origin", Map.of("ip", "200.160.1.1")), null));

        assertEquals(List.of(AnomalyReason.LOCATION_MISMATCH), v.reasons());
        for (SignalType t : List.of(SignalType.GPS, SignalType.WIFI_AP, SignalType.IP_ORIGIN)) {
            double w = v.weightOf(t);
            assertTrue(w > 0.0 && w <= 0.2, t + " weight " + w);
        }
    }

    @Test
    @DisplayName("A stale GPS fix does not raise a location mismatch")
    void staleGpsIsNotTrustedForCrossCheck() {
        ValidatedVector v = validate(new SignalBundle("s1", Map.of(
                "gps", Map.of("lat", -22.9068, "lon", -43.1729, "observed_at", "2026-10-15T11:00:00Z"),
                "wifi_ap", Map.of("bssid", "aa:bb:cc:dd:ee:01"),
                "ip_origin", Map.of("ip", "200.160.1.1")), null));

        assertEquals(List.of(AnomalyReason.SIGNAL_STALE), v.reasons());
        assertEquals(0.0, v.weightOf(SignalType.GPS));
        assertTrue(v.weights().containsKey("gps"));
        assertEquals(0.80, v.weightOf(SignalType.WIFI_AP), 1e-9);
    }

    @Test
    @DisplayName("A stale Wi-Fi fix is not held against a fresh GPS fix")
    void staleOtherSubjectIsNotTrustedForCrossCheck() {
        ValidatedVector v = validate(new SignalBundle("s1", Map.of(
                "gps", Map.of("lat", -22.9068, "lon", -43.1729),
                "wifi_ap", Map.of("bssid", "aa:bb:cc:dd:ee:01", "observed_at", "2026-10-15T11:00:00Z")), null));

        assertFalse(v.reasons().contains(AnomalyReason.LOCATION_MISMATCH), () -> "unexpected " + v.reasons());
        assertTrue(v.reasons().contains(AnomalyReason.SIGNAL_STALE));
        assertEquals(0.90, v.weightOf(SignalType.GPS), 1e-9);
        assertEquals(0.0, v.weightOf(SignalType.WIFI_AP));
    }

    @Test
    @DisplayName("A signal sent as a scalar instead of an object is malformed, not dropped")
    void scalarSignalIsMalformed() {
        Map<String, Object> signals = new LinkedHashMap<>();
        signals.put("ip_origin", Map.of("ip", "81.2.69.160"));
        signals.put("gps", "51.5,-0.12");
        ValidatedVector v = validate(SignalBundle.fromJson("s1", signals, null));

        assertTrue(v.weights().containsKey("gps"));
        assertEquals(0.0, v.weightOf(SignalType.GPS));
        assertEquals(0.70, v.weightOf(SignalType.IP_ORIGIN), 1e-9);
        assertEquals(List.of(AnomalyReason.SIGNAL_MALFORMED), v.reasons());
    }

    @Test
    @DisplayName("Malformed signals weigh zero and absent expected signals are reported")
    void malformedAndMissing() {
        ValidatedVector v = validate(new SignalBundle("s1", Map.of(
                "wifi_ap", Map.of("bssid", "garbage")), null));

        assertEquals(List.of(AnomalyReason.SIGNAL_MALFORMED, AnomalyReason.SIGNAL_MISSING), v.reasons());
        assertEquals(0.0, v.weightOf(SignalType.WIFI_AP));
        assertFalse(v.weights().containsKey("ip_origin"));
    }

    @Test
    @DisplayName("Signals without a reference entry are penalised")
    void unresolvedPenalty() {
        ValidatedVector v = validate(new SignalBundle("s1", Map.of(
                "ip_origin", Map.of("ip", "192.168.1.1")), null));

        assertEquals(0.35, v.weightOf(SignalType.IP_ORIGIN), 1e-9);
    }

    @Test
    @DisplayName("Content findings add reasons without lowering weights")
    void contentFindings() {
        ValidatedVector v = validate(new SignalBundle("s1", Map.of(
                "ip_origin", Map.of("ip", "81.2.69.160"),
                "device_posture", Map.of("device_id", "dev-002"),
                "tls_fingerprint", Map.of("ja3", "6734f37431670b3ab4292b8f60f29984")), null));

        assertEquals(List.of(AnomalyReason.TLS_ANOMALY, AnomalyReason.POSTURE_OUTDATED,
                AnomalyReason.DEVICE_UNHEALTHY), v.reasons());
        assertEquals(0.60, v.weightOf(SignalType.TLS_FINGERPRINT), 1e-9);
        assertEquals(0.85, v.weightOf(SignalType.DEVICE_POSTURE), 1e-9);
    }

    @Test
    @DisplayName("An old last_update marks the posture outdated even when patched")
    void oldPostureUpdate() {
        ValidatedVector v = validate(new SignalBundle("s1", Map.of(
                "ip_origin", Map.of("ip", "81.2.69.160"),
                "device_posture", Map.of("device_id", "dev-003")), null));

        assertEquals(List.of(AnomalyReason.POSTURE_OUTDATED), v.reasons());
    }

    @Test
    @DisplayName("Payload posture fields override the reference record")
    void payloadPostureWins() {
        ValidatedVector v = validate(new SignalBundle("s1", Map.of(
                "ip_origin", Map.of("ip", "81.2.69.160"),
                "device_posture", Map.of("device_id", "dev-001", "patched", false)), null));

        assertEquals(List.of(AnomalyReason.POSTURE_OUTDATED), v.reasons());
    }

    @Test
    @DisplayName("Threat labels come after signal reasons")
    void labelReasonsLast() {
        ValidatedVector v = validate(new SignalBundle("s1", Map.of(
                "ip_origin", Map.of("ip", "81.2.69.160"),
                "tls_fingerprint", Map.of("ja3", "6734f37431670b3ab4292b8f60f29984")), "Heartbleed"));

        assertEquals(List.of(AnomalyReason.TLS_ANOMALY, AnomalyReason.DOWNLOAD_EXFIL), v.reasons());
    }

    @Test
    @DisplayName("Validation is deterministic and every weight stays within [0,1]")
    void deterministicAndBounded() {
        SignalBundle bundle = new SignalBundle("s1", Map.of(
                "ip_origin", Map.of("ip", "200.160.1.1"),
                "gps", Map.of("lat", 51.5, "lon", -0.12),
                "wifi_ap", Map.of("bssid", "aa:bb:cc:dd:ee:01"),
                "device_posture", Map.of("device_id", "nobody")), "PortScan");

        ValidatedVector first = validate(bundle);
        ValidatedVector second = validate(bundle);

        assertEquals(first, second);
        first.weights().values().forEach(w -> assertTrue(w >= 0.0 && w <= 1.0));
        assertTrue(first.reasons().contains(AnomalyReason.RECONNAISSANCE));
        assertEquals(1, first.reasons().stream().filter(r -> r == AnomalyReason.LOCATION_MISMATCH).count());
    }

    @Test
    @DisplayName("Legacy signal keys are accepted")
    void legacyKeys() {
        ValidatedVector v = validate(new SignalBundle("s1", Map.of(
                "ip_geo", Map.of("ip", "81.2.69.160"),
                "tls_fp", Map.of("ja3", "771f2b1b1e6b6c1d9a5e7a3b4c5d6e7f")), null));

        assertTrue(v.reasons().isEmpty());
        assertEquals(0.70, v.weightOf(SignalType.IP_ORIGIN), 1e-9);
        assertEquals(0.60, v.weightOf(SignalType.TLS_FINGERPRINT), 1e-9);
    }
}
