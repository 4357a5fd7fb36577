package tech.noetzold.zta.validation_api.service;

/**
 * Great-circle distance on a spherical earth.
 */
public final class GeoDistance {

    static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {}

    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return round3(EARTH_RADIUS_KM * c);
    }

    static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }

    static boolean validCoordinates(double lat, double lon) {
        return lat >= -90.0 && lat <= 90.0 && lon >= -180.0 && lon <= 180.0;
    }
}
