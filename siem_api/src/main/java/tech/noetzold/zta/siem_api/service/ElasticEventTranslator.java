package tech.noetzold.zta.siem_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.zta.common.model.AlertIngestRequest;
import tech.noetzold.zta.common.model.AlertSeverity;
import tech.noetzold.zta.common.model.AnomalyReason;
import tech.noetzold.zta.common.model.StrideCategory;
import tech.noetzold.zta.siem_api.config.SiemProperties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns Elastic documents into alert ingest requests: Kibana/Elastic alert webhooks,
 * and decision events read back from the search index, whose severity and STRIDE
 * category have to be derived from the event fields.
 */
@Component
public class ElasticEventTranslator {

    static final String UNKNOWN_SESSION = "sess-unknown";
    static final String WEBHOOK_SOURCE = "elastic";

    /** Reason tokens emitted by older collectors that have no {@link AnomalyReason}. */
    private static final Map<String, StrideCategory> LEGACY_REASONS = Map.ofEntries(
            Map.entry("GPS_MISMATCH", StrideCategory.SPOOFING),
            Map.entry("IP_GEO_MISMATCH", StrideCategory.SPOOFING),
            Map.entry("WIFI_MISMATCH", StrideCategory.SPOOFING),
            Map.entry("IMPOSSIBLE_TRAVEL", StrideCategory.SPOOFING),
            Map.entry("JA3_SUSPECT", StrideCategory.TAMPERING),
            Map.entry("CREDENTIAL_STUFFING", StrideCategory.REPUDIATION));

    private static final List<String> REASON_FIELDS = List.of("reasons", "reason_codes", "why", "notes", "reason");

    private static final Set<String> HIGH_DECISIONS = Set.of("BLOCK", "DENY");

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final SiemProperties props;

    public ElasticEventTranslator(SiemProperties props) {
        this.props = props;
    }

    /**
     * Webhook payload from a Kibana rule action. Severity defaults to low so an
     * unlabelled rule does not raise the session's risk.
     */
    public AlertIngestRequest fromWebhook(Map<String, Object> payload) {
        if (payload == null) {
            throw new IllegalArgumentException("alert payload is required");
        }
        String severity = firstText(
                at(payload, "kibana", "alert", "severity"),
                at(payload, "event", "severity"),
                payload.get("severity"));
        String stride = firstText(
                payload.get("stride"),
                at(payload, "threat", "technique"));
        String session = firstText(
                payload.get("session_id"),
                at(payload, "related", "session"),
                at(payload, "user", "id"),
                at(payload, "user", "name"));

        return new AlertIngestRequest(
                session != null ? session : UNKNOWN_SESSION,
                severity != null ? AlertSeverity.parse(severity) : AlertSeverity.LOW,
                StrideCategory.parse(stride),
                WEBHOOK_SOURCE,
                payload);
    }

    /**
     * One {@code _search} hit. The document id is kept as {@code raw._id} so the same
     * hit read on a later run is recognised as already stored.
     */
    public AlertIngestRequest fromIndexHit(String index, Map<String, Object> hit) {
        Map<String, Object> src = asMap(hit.get("_source"));
        String session = firstText(src.get(props.getPoller().getSessionField()), at(src, "user", "name"));

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(AlertIngestService.EXTERNAL_ID_KEY, hit.get("_id"));
        raw.putAll(src);

        return new AlertIngestRequest(
                session != null ? session : UNKNOWN_SESSION,
                deriveSeverity(src),
                deriveStride(src),
                "es:" + index,
                raw);
    }

    /**
     * A numeric risk maps through the configured cut-offs. Without one, a blocking
     * decision is high and an MFA enforcement is medium; anything else is low.
     */
    public AlertSeverity deriveSeverity(Map<String, Object> src) {
        Double risk = firstNumber(src.get("risk"), src.get("risk_score"), src.get("risk_value"));
        if (risk != null) {
            SiemProperties.Severity cut = props.getSeverity();
            if (risk >= cut.getHigh()) return AlertSeverity.HIGH;
            if (risk >= cut.getMedium()) return AlertSeverity.MEDIUM;
            return AlertSeverity.LOW;
        }
        String decision = token(src.get("decision"));
        String enforcement = token(src.get("enforcement"));
        if (HIGH_DECISIONS.contains(decision)) return AlertSeverity.HIGH;
        if (enforcement.contains("MFA")) return AlertSeverity.MEDIUM;
        return AlertSeverity.LOW;
    }

    /**
     * First mapped token of {@code reasons}, then the first token of any reason-like
     * field, then boolean hint fields; InformationDisclosure when nothing matches.
     */
    public StrideCategory deriveStride(Map<String, Object> src) {
        for (String reason : texts(src.get("reasons"))) {
            StrideCategory mapped = mapReason(token(reason));
            if (mapped != null) return mapped;
        }
        String first = firstReasonToken(src);
        if (!first.isEmpty()) {
            StrideCategory mapped = mapReason(first);
            if (mapped != null) return mapped;
        }
        if (anyFlag(src, "gps_mismatch", "ip_geo_mismatch", "wifi_mismatch", "impossible_travel")) {
            return StrideCategory.SPOOFING;
        }
        if (anyFlag(src, "tls_anomaly", "ja3_suspect", "device_unhealthy", "posture_outdated")) {
            return StrideCategory.TAMPERING;
        }
        if (anyFlag(src, "exfil", "data_leak")) return StrideCategory.INFORMATION_DISCLOSURE;
        if (anyFlag(src, "brute_force")) return StrideCategory.DENIAL_OF_SERVICE;
        return StrideCategory.INFORMATION_DISCLOSURE;
    }

    private StrideCategory mapReason(String token) {
        if (token.isEmpty()) return null;
        for (Map.Entry<String, String> e : props.getStrideOverrides().entrySet()) {
            if (token(e.getKey()).equals(token)) {
                return StrideCategory.parse(e.getValue());
            }
        }
        for (AnomalyReason r : AnomalyReason.values()) {
            if (r.name().equals(token)) return r.stride();
        }
        return LEGACY_REASONS.get(token);
    }

    private static String firstReasonToken(Map<String, Object> src) {
        for (String field : REASON_FIELDS) {
            List<String> values = texts(src.get(field));
            if (!values.isEmpty()) return token(values.get(0));
        }
        if (anyFlag(src, "gps_mismatch", "impossible_travel")) return "GPS_MISMATCH";
        if (anyFlag(src, "wifi_mismatch", "bssid_mismatch")) return "WIFI_MISMATCH";
        if (anyFlag(src, "ip_geo_mismatch")) return "IP_GEO_MISMATCH";
        if (anyFlag(src, "tls_anomaly", "ja3_suspect")) return "TLS_ANOMALY";
        if (anyFlag(src, "device_unhealthy", "posture_outdated")) return "DEVICE_UNHEALTHY";
        if (anyFlag(src, "brute_force")) return "BRUTE_FORCE";
        if (anyFlag(src, "exfil", "data_leak")) return "DOWNLOAD_EXFIL";
        return "";
    }

    /** Non-null entries of a string, a list or an object's values. */
    private static List<String> texts(Object v) {
        List<String> out = new ArrayList<>();
        if (v instanceof String s) {
            if (!s.isBlank()) out.add(s);
        } else if (v instanceof Collection<?> c) {
            c.stream().filter(Objects::nonNull).forEach(x -> out.add(String.valueOf(x)));
        } else if (v instanceof Map<?, ?> m) {
            m.values().stream().filter(Objects::nonNull).forEach(x -> out.add(String.valueOf(x)));
        }
        return out;
    }

    private static boolean anyFlag(Map<String, Object> src, String... keys) {
        for (String k : keys) {
            if (truthy(src.get(k))) return true;
        }
        return false;
    }

    private static boolean truthy(Object v) {
        if (v == null) return false;
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.doubleValue() != 0;
        if (v instanceof String s) return !s.isEmpty();
        if (v instanceof Collection<?> c) return !c.isEmpty();
        if (v instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    static String token(Object v) {
        if (v == null) return "";
        return String.valueOf(v).trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
    }

    private static Double firstNumber(Object... candidates) {
        for (Object c : candidates) {
            if (c instanceof Number n) return n.doubleValue();
            if (c instanceof String s && NUMBER.matcher(s.trim()).matches()) {
                return Double.parseDouble(s.trim());
            }
        }
        return null;
    }

    /** First candidate that is a non-blank string or a number. */
    private static String firstText(Object... candidates) {
        for (Object c : candidates) {
            if (c instanceof String s && !s.isBlank()) return s.trim();
            if (c instanceof Number n) return n.toString();
        }
        return null;
    }

    private static Object at(Map<String, Object> root, String... path) {
        Object cur = root;
        for (String p : path) {
            if (!(cur instanceof Map<?, ?> m)) return null;
            cur = m.get(p);
        }
        return cur;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object v) {
        return v instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }
}
