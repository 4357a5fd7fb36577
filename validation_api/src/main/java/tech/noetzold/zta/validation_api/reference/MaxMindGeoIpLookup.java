package tech.noetzold.zta.validation_api.reference;

import com.maxmind.geoip2.DatabaseReader;
import com.maxmind.geoip2.exception.GeoIp2Exception;
import com.maxmind.geoip2.model.CityResponse;
import com.maxmind.geoip2.record.Location;
import tech.noetzold.zta.validation_api.model.GeoLocation;

import java.io.IOException;
import java.net.InetAddress;
import java.util.Optional;

/**
 * City lookups against a MaxMind GeoIP2 / GeoLite2 City database.
 * Records without coordinates count as unresolved since they cannot be cross-checked.
 */
public class MaxMindGeoIpLookup implements GeoIpLookup {

    private final DatabaseReader reader;

    public MaxMindGeoIpLookup(DatabaseReader reader) {
        this.reader = reader;
    }

    @Override
    public Optional<GeoLocation> locate(InetAddress address) throws IOException {
        Optional<CityResponse> response;
        try {
            response = reader.tryCity(address);
        } catch (GeoIp2Exception e) {
            throw new IOException("GeoIP lookup failed for " + address.getHostAddress(), e);
        }
        return response.flatMap(MaxMindGeoIpLookup::toLocation);
    }

    @Override
    public String databaseType() {
        return reader.getMetadata().getDatabaseType();
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private static Optional<GeoLocation> toLocation(CityResponse r) {
        Location loc = r.getLocation();
        if (loc == null || loc.getLatitude() == null || loc.getLongitude() == null) {
            return Optional.empty();
        }
        String country = r.getCountry() != null ? r.getCountry().getIsoCode() : null;
        String city = r.getCity() != null ? r.getCity().getName() : null;
        return Optional.of(new GeoLocation(country, city, loc.getLatitude(), loc.getLongitude()));
    }
}
