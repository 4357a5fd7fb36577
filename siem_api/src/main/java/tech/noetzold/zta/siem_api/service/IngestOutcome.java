package tech.noetzold.zta.siem_api.service;

import tech.noetzold.zta.siem_api.model.SiemAlert;

/**
 * Result of an ingest. {@code duplicate} means an alert for the same search-index
 * document was already stored and {@code alert} is that earlier row.
 */
public record IngestOutcome(SiemAlert alert, boolean duplicate) {

    public static IngestOutcome stored(SiemAlert alert) {
        return new IngestOutcome(alert, false);
    }

    public static IngestOutcome duplicateOf(SiemAlert alert) {
        return new IngestOutcome(alert, true);
    }
}
