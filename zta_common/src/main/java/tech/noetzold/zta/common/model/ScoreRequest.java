package tech.noetzold.zta.common.model;

import java.util.List;
import java.util.Map;

/**
 * Body the gateway posts to the trust service.
 */
public record ScoreRequest(
        SignalBundle vector,
        Map<String, Double> weights,
        List<AnomalyReason> reasons,
        SiemCounts siem
) {

    public static ScoreRequest of(ValidatedVector validated, AlertWindowCount alerts) {
        return new ScoreRequest(validated.vector(), validated.weights(), validated.reasons(), SiemCounts.of(alerts));
    }

    public ValidatedVector toValidatedVector() {
        return new ValidatedVector(vector, weights, reasons);
    }

    public SiemCounts siemOrEmpty() {
        return siem == null ? new SiemCounts(0, 0) : siem;
    }
}
