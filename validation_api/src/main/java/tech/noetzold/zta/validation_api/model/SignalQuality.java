package tech.noetzold.zta.validation_api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record SignalQuality(
        boolean present,
        @JsonProperty("well_formed") boolean wellFormed,
        boolean fresh,
        String detail
) {

    public static SignalQuality ok() {
        return new SignalQuality(true, true, true, null);
    }

    public static SignalQuality absent() {
        return new SignalQuality(false, false, false, "empty payload");
    }

    public static SignalQuality malformed(String detail) {
        return new SignalQuality(true, false, true, detail);
    }

    public static SignalQuality stale(String detail) {
        return new SignalQuality(true, true, false, detail);
    }

    @JsonIgnore
    public boolean passed() {
        return present && wellFormed && fresh;
    }
}
