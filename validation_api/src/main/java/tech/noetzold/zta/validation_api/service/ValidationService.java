package tech.noetzold.zta.validation_api.service;

import org.springframework.stereotype.Service;
import tech.noetzold.zta.common.model.SignalBundle;
import tech.noetzold.zta.common.model.ValidationResponse;
import tech.noetzold.zta.validation_api.model.ConsistencyCheck;
import tech.noetzold.zta.validation_api.model.EnrichmentResult;
import tech.noetzold.zta.validation_api.model.ValidationOutcome;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class ValidationService {

    private final SignalEnrichmentResolver resolver;
    private final SignalValidator validator;

    public ValidationService(SignalEnrichmentResolver resolver, SignalValidator validator) {
        this.resolver = resolver;
        this.validator = validator;
    }

    public ValidationResponse validate(SignalBundle bundle) {
        EnrichmentResult enrichment = resolver.enrich(bundle);
        ValidationOutcome outcome = validator.assess(bundle, enrichment);

        Map<String, Object> quality = new LinkedHashMap<>();
        outcome.quality().forEach((t, q) -> quality.put(t.key(), q));

        Map<String, Object> cross = new LinkedHashMap<>();
        for (ConsistencyCheck c : enrichment.checks()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("value", c.value());
            entry.put("threshold", c.threshold());
            entry.put("exceeded", c.exceeded());
            entry.put("subjects", c.subjects());
            cross.put(c.metricName(), entry);
        }

        return new ValidationResponse(outcome.validated(), quality, cross, enrichment.toDiagnostics());
    }
}
