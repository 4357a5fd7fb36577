package tech.noetzold.zta.validation_api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.noetzold.zta.common.model.SignalType;

import java.util.List;

public record ConsistencyCheck(
        @JsonProperty("metric_name") String metricName,
        double value,
        double threshold,
        List<SignalType> subjects
) {

    public ConsistencyCheck {
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
    }

    @JsonIgnore
    public boolean exceeded() {
        return value > threshold;
    }
}
