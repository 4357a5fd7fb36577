package tech.noetzold.zta.validation_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import tech.noetzold.zta.common.model.SignalBundle;

import java.util.Map;

/**
 * Inbound body of {@code /validation/validate}. Both the structured shape
 * ({@code session_id} and {@code label} at the top level) and the flat shape
 * (everything inside {@code signals}) are accepted.
 */
public record ValidateRequest(
        @JsonProperty("session_id") String sessionId,
        Map<String, Object> signals,
        String label
) {

    public SignalBundle toBundle() {
        SignalBundle flat = SignalBundle.fromFlat(signals);
        String sid = (sessionId != null && !sessionId.isBlank()) ? sessionId : flat.sessionId();
        String lab = (label != null && !label.isBlank()) ? label : flat.label();
        return new SignalBundle(sid, flat.signals(), lab);
    }
}
