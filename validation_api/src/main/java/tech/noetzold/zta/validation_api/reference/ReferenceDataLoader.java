package tech.noetzold.zta.validation_api.reference;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.maxmind.db.CHMCache;
import com.maxmind.geoip2.DatabaseReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import tech.noetzold.zta.validation_api.config.ValidationProperties;
import tech.noetzold.zta.validation_api.model.DevicePosture;
import tech.noetzold.zta.validation_api.model.WifiAccessPoint;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the GeoIP database and the reference CSV files into a fresh {@link ReferenceDataSnapshot}.
 * A missing or unreadable file leaves its dataset empty and is reported in the snapshot status.
 * Rows that cannot be parsed are skipped.
 * <p>
 * Locations are Spring resource strings ({@code classpath:}, {@code file:}); a bare absolute
 * path is read from the file system.
 */
@Slf4j
@Component
public class ReferenceDataLoader {

    private final ResourceLoader resourceLoader;
    private final ValidationProperties props;
    private final Clock clock;
    private final CsvMapper csvMapper = new CsvMapper();

    public ReferenceDataLoader(ResourceLoader resourceLoader, ValidationProperties props, Clock clock) {
        this.resourceLoader = resourceLoader;
        this.props = props;
        this.clock = clock;
    }

    public ReferenceDataSnapshot load() {
        ValidationProperties.Reference paths = props.getReference();
        Map<String, Boolean> status = new LinkedHashMap<>();

        Optional<GeoIpLookup> geo = openGeoIp(paths.getGeoip());
        Optional<List<Map<String, String>>> wifiRows = readRows("wifi", paths.getWifi());
        Optional<List<Map<String, String>>> tlsRows = readRows("tls", paths.getTls());
        Optional<List<Map<String, String>>> devRows = readRows("device", paths.getDevice());

        status.put("geoip", geo.isPresent());
        status.put("wifi", wifiRows.isPresent());
        status.put("tls", tlsRows.isPresent());
        status.put("device", devRows.isPresent());

        Map<String, WifiAccessPoint> aps = new HashMap<>();
        for (Map<String, String> row : wifiRows.orElse(List.of())) {
            try {
                String bssid = ReferenceDataSnapshot.normalizeBssid(row.get("bssid"));
                aps.put(bssid, new WifiAccessPoint(bssid, blankToNull(row.get("ssid")),
                        Double.parseDouble(row.get("lat").trim()),
                        Double.parseDouble(row.get("lon").trim())));
            } catch (RuntimeException e) {
                log.warn("Skipping wifi_aps row {}: {}", row, e.getMessage());
            }
        }

        Map<String, String> tags = new HashMap<>();
        for (Map<String, String> row : tlsRows.orElse(List.of())) {
            String ja3 = row.get("ja3");
            if (ja3 == null || ja3.isBlank()) continue;
            tags.put(ja3.trim().toLowerCase(Locale.ROOT), row.getOrDefault("tag", "").trim());
        }

        Map<String, DevicePosture> devices = new HashMap<>();
        for (Map<String, String> row : devRows.orElse(List.of())) {
            String id = row.get("device_id");
            if (id == null || id.isBlank()) continue;
            devices.put(id.trim(), new DevicePosture(
                    id.trim(),
                    blankToNull(row.get("os")),
                    parseBool(row.get("patched")),
                    blankToNull(row.get("edr")),
                    blankToNull(row.get("last_update"))));
        }

        ReferenceDataSnapshot snapshot = new ReferenceDataSnapshot(
                geo.orElse(GeoIpLookup.NONE), aps, tags, devices, status, clock.instant());
        log.info("Reference data loaded: status={} sizes={}", status, snapshot.sizes());
        return snapshot;
    }

    /**
     * Opens the MaxMind city database fully into memory, so closing a retired
     * snapshot never invalidates a mapped file still being read.
     */
    protected Optional<GeoIpLookup> openGeoIp(String location) {
        Optional<Resource> resource = resolve("geoip", location);
        if (resource.isEmpty()) {
            return Optional.empty();
        }
        try (InputStream in = resource.get().getInputStream()) {
            DatabaseReader reader = new DatabaseReader.Builder(in).withCache(new CHMCache()).build();
            MaxMindGeoIpLookup lookup = new MaxMindGeoIpLookup(reader);
            log.info("GeoIP database {} opened from {}", lookup.databaseType(), location);
            return Optional.of(lookup);
        } catch (IOException | RuntimeException e) {
            log.warn("GeoIP database at {} could not be opened: {}", location, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Resource> resolve(String dataset, String location) {
        if (location == null || location.isBlank()) {
            log.warn("No location configured for reference dataset {}", dataset);
            return Optional.empty();
        }
        String trimmed = location.trim();
        Resource resource = trimmed.startsWith("/")
                ? new FileSystemResource(trimmed)
                : resourceLoader.getResource(trimmed);
        if (!resource.exists()) {
            log.warn("Reference dataset {} not found at {}", dataset, location);
            return Optional.empty();
        }
        return Optional.of(resource);
    }

    private Optional<List<Map<String, String>>> readRows(String dataset, String location) {
        Optional<Resource> resolved = resolve(dataset, location);
        if (resolved.isEmpty()) {
            return Optional.empty();
        }
        Resource resource = resolved.get();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (InputStream in = resource.getInputStream();
             MappingIterator<Map<String, String>> it = csvMapper
                     .readerForMapOf(String.class)
                     .with(schema)
                     .readValues(in)) {
            List<Map<String, String>> rows = new ArrayList<>();
            while (it.hasNextValue()) {
                rows.add(it.nextValue());
            }
            return Optional.of(rows);
        } catch (IOException | RuntimeException e) {
            log.warn("Reference dataset {} at {} could not be read: {}", dataset, location, e.getMessage());
            return Optional.empty();
        }
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    private static Boolean parseBool(String s) {
        if (s == null || s.isBlank()) return null;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "y" -> Boolean.TRUE;
            case "false", "0", "no", "n" -> Boolean.FALSE;
            default -> null;
        };
    }
}
