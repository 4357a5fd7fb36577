package tech.noetzold.zta.validation_api.reference;

import lombok.extern.slf4j.Slf4j;
import tech.noetzold.zta.validation_api.model.DevicePosture;
import tech.noetzold.zta.validation_api.model.GeoLocation;
import tech.noetzold.zta.validation_api.model.WifiAccessPoint;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view over every reference dataset, built once and never mutated.
 * A reload produces a new snapshot; the retired one is closed to release the GeoIP database.
 */
@Slf4j
public final class ReferenceDataSnapshot implements Closeable {

    private final GeoIpLookup geo;
    private final Map<String, WifiAccessPoint> accessPoints;
    private final Map<String, String> tlsTags;
    private final Map<String, DevicePosture> devices;
    private final Map<String, Boolean> status;
    private final Instant loadedAt;

    public ReferenceDataSnapshot(GeoIpLookup geo,
                                 Map<String, WifiAccessPoint> accessPoints,
                                 Map<String, String> tlsTags,
                                 Map<String, DevicePosture> devices,
                                 Map<String, Boolean> status,
                                 Instant loadedAt) {
        this.geo = geo != null ? geo : GeoIpLookup.NONE;
        this.accessPoints = Map.copyOf(accessPoints);
        this.tlsTags = Map.copyOf(tlsTags);
        this.devices = Map.copyOf(devices);
        this.status = Map.copyOf(status);
        this.loadedAt = loadedAt;
    }

    public static ReferenceDataSnapshot empty() {
        return new ReferenceDataSnapshot(GeoIpLookup.NONE, Map.of(), Map.of(), Map.of(),
                Map.of("geoip", false, "wifi", false, "tls", false, "device", false), Instant.EPOCH);
    }

    /** Location for an address literal. Host names are never resolved. */
    public Optional<GeoLocation> geoFor(String ip) {
        Optional<byte[]> bytes = IpLiterals.parse(ip);
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        try {
            return geo.locate(InetAddress.getByAddress(bytes.get()));
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Parsed address has an invalid length", e);
        } catch (IOException e) {
            log.warn("GeoIP lookup for {} failed: {}", ip, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<WifiAccessPoint> accessPoint(String bssid) {
        if (bssid == null) return Optional.empty();
        return Optional.ofNullable(accessPoints.get(normalizeBssid(bssid)));
    }

    public Optional<String> tlsTag(String ja3) {
        if (ja3 == null) return Optional.empty();
        String tag = tlsTags.get(ja3.trim().toLowerCase(Locale.ROOT));
        return (tag == null || tag.isBlank()) ? Optional.empty() : Optional.of(tag);
    }

    public Optional<DevicePosture> device(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(devices.get(deviceId.trim()));
    }

    /** Dataset name to whether it was loaded. */
    public Map<String, Boolean> status() {
        return status;
    }

    public Instant loadedAt() {
        return loadedAt;
    }

    public Map<String, Integer> sizes() {
        return Map.of(
                "wifi", accessPoints.size(),
                "tls", tlsTags.size(),
                "device", devices.size());
    }

    /** GeoIP database edition in use, or null when none is loaded. */
    public String geoIpDatabase() {
        return geo.databaseType();
    }

    @Override
    public void close() throws IOException {
        geo.close();
    }

    static String normalizeBssid(String bssid) {
        return bssid.trim().toLowerCase(Locale.ROOT).replace('-', ':');
    }
}
