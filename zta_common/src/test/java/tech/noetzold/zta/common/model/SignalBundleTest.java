package tech.noetzold.zta.common.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignalBundleTest {

    @Test
    @DisplayName("Flat bodies split into session, label and signal objects")
    void fromFlat() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("session_id", "s1");
        raw.put("label", " PortScan ");
        raw.put("ip_geo", Map.of("ip", "8.8.8.8"));
        raw.put("noise", 42);

        SignalBundle b = SignalBundle.fromFlat(raw);

        assertEquals("s1", b.sessionId());
        assertEquals("PortScan", b.label());
        assertEquals(1, b.signals().size());
        assertEquals("8.8.8.8", b.signal(SignalType.IP_ORIGIN).orElseThrow().get("ip"));
    }

    @Test
    @DisplayName("Legacy keys are recognised as their signal types")
    void aliases() {
        SignalBundle b = new SignalBundle("s1", Map.of(
                "wifi_bssid", Map.of("bssid", "aa:bb:cc:dd:ee:ff"),
                "tls_fp", Map.of("ja3", "x"),
                "weather", Map.of("sunny", true)), null);

        assertEquals(EnumSet.of(SignalType.WIFI_AP, SignalType.TLS_FINGERPRINT), b.observedTypes());
        assertTrue(b.signal(SignalType.GPS).isEmpty());
        assertFalse(b.hasNoEvidence());
    }

    @Test
    @DisplayName("Blank labels and null payloads are dropped")
    void normalises() {
        Map<String, Map<String, Object>> sigs = new LinkedHashMap<>();
        sigs.put("gps", null);
        SignalBundle b = new SignalBundle(null, sigs, "  ");

        assertNull(b.label());
        assertTrue(b.signals().isEmpty());
        assertTrue(b.hasNoEvidence());
        assertThrows(UnsupportedOperationException.class, () -> b.signals().put("gps", Map.of()));
    }

    @Test
    @DisplayName("The session id is read from its snake case key")
    void json() throws Exception {
        SignalBundle b = new ObjectMapper().readValue(
                "{\"session_id\":\"s9\",\"signals\":{\"gps\":{\"lat\":1.5,\"lon\":2.5}}}", SignalBundle.class);

        assertEquals("s9", b.sessionId());
        assertEquals(1.5, b.signal(SignalType.GPS).orElseThrow().get("lat"));
    }

    @Test
    @DisplayName("Non-object values under signal keys stay observed as unreadable payloads")
    void scalarValuesKept() throws Exception {
        SignalBundle b = new ObjectMapper().readValue(
                "{\"session_id\":\"s1\",\"signals\":{\"gps\":\"51.5,-0.12\",\"tls_fp\":[1,2],"
                        + "\"device_posture\":null,\"weather\":\"sunny\"}}", SignalBundle.class);

        assertEquals(EnumSet.of(SignalType.GPS, SignalType.TLS_FINGERPRINT, SignalType.DEVICE_POSTURE),
                b.observedTypes());
        assertTrue(SignalBundle.isUnreadable(b.signal(SignalType.GPS).orElseThrow()));
        assertEquals("51.5,-0.12", b.signal(SignalType.GPS).orElseThrow().get(SignalBundle.UNREADABLE_VALUE));
        assertTrue(SignalBundle.isUnreadable(b.signal(SignalType.TLS_FINGERPRINT).orElseThrow()));
        assertTrue(b.signal(SignalType.DEVICE_POSTURE).orElseThrow().isEmpty());
        assertFalse(b.signals().containsKey("weather"));
    }

    @Test
    @DisplayName("Flat bodies keep scalar values under signal keys only")
    void flatScalarValues() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("session_id", "s1");
        raw.put("gps", 42);
        raw.put("noise", "x");

        SignalBundle b = SignalBundle.fromFlat(raw);

        assertEquals(EnumSet.of(SignalType.GPS), b.observedTypes());
        assertEquals("42", b.signal(SignalType.GPS).orElseThrow().get(SignalBundle.UNREADABLE_VALUE));
    }
}
