package tech.noetzold.zta.validation_api.model;

public record WifiAccessPoint(
        String bssid,
        String ssid,
        double lat,
        double lon
) {}
