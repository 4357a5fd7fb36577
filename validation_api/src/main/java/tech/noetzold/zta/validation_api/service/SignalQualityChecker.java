package tech.noetzold.zta.validation_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.zta.common.model.SignalBundle;
import tech.noetzold.zta.common.model.SignalType;
import tech.noetzold.zta.validation_api.config.ValidationProperties;
import tech.noetzold.zta.validation_api.model.SignalQuality;
import tech.noetzold.zta.validation_api.reference.IpLiterals;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Presence, shape and freshness checks for a single signal payload.
 */
@Component
public class SignalQualityChecker {

    static final String OBSERVED_AT = "observed_at";

    private static final Pattern BSSID = Pattern.compile("^[0-9a-fA-F]{2}([:-][0-9a-fA-F]{2}){5}$");
    private static final Pattern JA3 = Pattern.compile("^[0-9a-fA-F]{32}$");

    private final ValidationProperties props;
    private final Clock clock;

    public SignalQualityChecker(ValidationProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    public SignalQuality check(SignalType type, Map<String, Object> payload) {
        if (SignalBundle.isUnreadable(payload)) {
            return SignalQuality.malformed("value is not an object");
        }
        if (payload == null || payload.isEmpty()) {
            return SignalQuality.absent();
        }
        Optional<String> shapeProblem = shapeProblem(type, payload);
        if (shapeProblem.isPresent()) {
            return SignalQuality.malformed(shapeProblem.get());
        }
        Optional<Instant> observedAt;
        try {
            observedAt = SignalPayloads.instant(payload.get(OBSERVED_AT));
        } catch (IllegalArgumentException e) {
            return SignalQuality.malformed(e.getMessage());
        }
        if (observedAt.isPresent()) {
            Instant now = clock.instant();
            Duration age = Duration.between(observedAt.get(), now);
            if (age.compareTo(props.getMaxSignalAge()) > 0) {
                return SignalQuality.stale("observed " + age.toSeconds() + "s ago");
            }
            if (age.negated().compareTo(props.getMaxClockSkew()) > 0) {
                return SignalQuality.stale("observed " + age.negated().toSeconds() + "s in the future");
            }
        }
        return SignalQuality.ok();
    }

    private Optional<String> shapeProblem(SignalType type, Map<String, Object> p) {
        switch (type) {
            case IP_ORIGIN: {
                Optional<String> ip = SignalPayloads.text(p, "ip");
                if (ip.isEmpty()) return Optional.of("ip is required");
                return IpLiterals.isLiteral(ip.get()) ? Optional.empty() : Optional.of("ip is not an address literal");
            }
            case GPS: {
                Optional<Double> lat = SignalPayloads.number(p, "lat");
                Optional<Double> lon = SignalPayloads.number(p, "lon");
                if (lat.isEmpty() || lon.isEmpty()) return Optional.of("lat and lon are required");
                return GeoDistance.validCoordinates(lat.get(), lon.get())
                        ? Optional.empty() : Optional.of("coordinates out of range");
            }
            case WIFI_AP: {
                Optional<String> bssid = SignalPayloads.text(p, "bssid");
                if (bssid.isEmpty()) return Optional.of("bssid is required");
                return BSSID.matcher(bssid.get()).matches() ? Optional.empty() : Optional.of("bssid is malformed");
            }
            case DEVICE_POSTURE:
                return SignalPayloads.text(p, "device_id").isPresent()
                        ? Optional.empty() : Optional.of("device_id is required");
            case TLS_FINGERPRINT: {
                Optional<String> ja3 = SignalPayloads.text(p, "ja3");
                if (ja3.isEmpty()) return Optional.of("ja3 is required");
                return JA3.matcher(ja3.get()).matches() ? Optional.empty() : Optional.of("ja3 is not a 32 hex digest");
            }
            default:
                return Optional.of("unsupported signal type");
        }
    }
}
