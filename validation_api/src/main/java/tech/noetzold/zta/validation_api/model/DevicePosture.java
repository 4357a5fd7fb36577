package tech.noetzold.zta.validation_api.model;

public record DevicePosture(
        String deviceId,
        String os,
        Boolean patched,     // null when the source did not say
        String edr,
        String lastUpdate    // ISO date or instant, as found in the dataset
) {}
