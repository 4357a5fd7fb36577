package tech.noetzold.zta.validation_api.reference;

import tech.noetzold.zta.validation_api.model.GeoLocation;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.util.Optional;

/**
 * Resolves an address to a location. Implementations may hold native or file resources,
 * released by {@link #close()} once the owning snapshot is retired.
 */
public interface GeoIpLookup extends Closeable {

    GeoIpLookup NONE = new GeoIpLookup() {
        @Override
        public Optional<GeoLocation> locate(InetAddress address) {
            return Optional.empty();
        }

        @Override
        public String databaseType() {
            return null;
        }

        @Override
        public void close() {
        }
    };

    /** Location with coordinates, or empty when the address is not covered. */
    Optional<GeoLocation> locate(InetAddress address) throws IOException;

    /** Database edition, e.g. {@code GeoLite2-City}, or null when nothing is loaded. */
    String databaseType();
}
