package tech.noetzold.zta.validation_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.zta.common.model.SignalBundle;
import tech.noetzold.zta.common.model.SignalType;
import tech.noetzold.zta.validation_api.config.ValidationProperties;
import tech.noetzold.zta.validation_api.model.ConsistencyCheck;
import tech.noetzold.zta.validation_api.model.DevicePosture;
import tech.noetzold.zta.validation_api.model.EnrichmentResult;
import tech.noetzold.zta.validation_api.model.GeoLocation;
import tech.noetzold.zta.validation_api.model.WifiAccessPoint;
import tech.noetzold.zta.validation_api.reference.ReferenceDataHolder;
import tech.noetzold.zta.validation_api.reference.ReferenceDataSnapshot;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves each signal against the reference datasets and measures how far the
 * GPS fix lies from the other location sources. Pure with respect to the snapshot
 * it reads, so repeated calls with the same bundle give the same result.
 */
@Slf4j
@Service
public class SignalEnrichmentResolver {

    public static final String GPS_WIFI_DISTANCE = "gps_wifi_distance_km";
    public static final String GPS_IP_DISTANCE = "gps_ip_distance_km";

    private final ReferenceDataHolder referenceData;
    private final ValidationProperties props;

    public SignalEnrichmentResolver(ReferenceDataHolder referenceData, ValidationProperties props) {
        this.referenceData = referenceData;
        this.props = props;
    }

    public EnrichmentResult enrich(SignalBundle bundle) {
        // one snapshot for the whole call, a concurrent reload is not observed halfway
        ReferenceDataSnapshot ref = referenceData.current();
        Map<SignalType, Map<String, Object>> annotations = new EnumMap<>(SignalType.class);

        Optional<GeoLocation> ipGeo = bundle.signal(SignalType.IP_ORIGIN)
                .flatMap(p -> SignalPayloads.text(p, "ip"))
                .flatMap(ref::geoFor);
        ipGeo.ifPresent(g -> annotations.put(SignalType.IP_ORIGIN, geoAnnotation(g)));

        Optional<WifiAccessPoint> ap = bundle.signal(SignalType.WIFI_AP)
                .flatMap(p -> SignalPayloads.text(p, "bssid"))
                .flatMap(ref::accessPoint);
        ap.ifPresent(a -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("ssid", a.ssid());
            m.put("lat", a.lat());
            m.put("lon", a.lon());
            annotations.put(SignalType.WIFI_AP, m);
        });

        bundle.signal(SignalType.TLS_FINGERPRINT)
                .flatMap(p -> SignalPayloads.text(p, "ja3"))
                .flatMap(ref::tlsTag)
                .ifPresent(tag -> annotations.put(SignalType.TLS_FINGERPRINT, Map.of("tag", tag)));

        bundle.signal(SignalType.DEVICE_POSTURE)
                .flatMap(p -> SignalPayloads.text(p, "device_id"))
                .flatMap(ref::device)
                .ifPresent(d -> annotations.put(SignalType.DEVICE_POSTURE, postureAnnotation(d)));

        List<ConsistencyCheck> checks = new ArrayList<>();
        gpsFix(bundle).ifPresent(gps -> {
            double threshold = props.getCrossCheck().getDistanceThresholdKm();
            ap.ifPresent(a -> checks.add(new ConsistencyCheck(GPS_WIFI_DISTANCE,
                    GeoDistance.haversineKm(gps[0], gps[1], a.lat(), a.lon()),
                    threshold, List.of(SignalType.GPS, SignalType.WIFI_AP))));
            ipGeo.ifPresent(g -> checks.add(new ConsistencyCheck(GPS_IP_DISTANCE,
                    GeoDistance.haversineKm(gps[0], gps[1], g.lat(), g.lon()),
                    threshold, List.of(SignalType.GPS, SignalType.IP_ORIGIN))));
        });

        log.debug("Enriched session={} resolved={} checks={}", bundle.sessionId(), annotations.keySet(), checks.size());
        return new EnrichmentResult(annotations, checks);
    }

    static Optional<double[]> gpsFix(SignalBundle bundle) {
        return bundle.signal(SignalType.GPS).flatMap(p -> {
            Optional<Double> lat = SignalPayloads.number(p, "lat");
            Optional<Double> lon = SignalPayloads.number(p, "lon");
            if (lat.isEmpty() || lon.isEmpty() || !GeoDistance.validCoordinates(lat.get(), lon.get())) {
                return Optional.empty();
            }
            return Optional.of(new double[]{lat.get(), lon.get()});
        });
    }

    private static Map<String, Object> geoAnnotation(GeoLocation g) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("country", g.country());
        m.put("city", g.city());
        m.put("lat", g.lat());
        m.put("lon", g.lon());
        return m;
    }

    private static Map<String, Object> postureAnnotation(DevicePosture d) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("os", d.os());
        m.put("patched", d.patched());
        m.put("edr", d.edr());
        m.put("last_update", d.lastUpdate());
        return m;
    }
}
