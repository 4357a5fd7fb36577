package tech.noetzold.zta.validation_api.model;

public record GeoLocation(
        String country,
        String city,
        double lat,
        double lon
) {}
