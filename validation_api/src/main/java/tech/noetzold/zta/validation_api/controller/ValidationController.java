package tech.noetzold.zta.validation_api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.noetzold.zta.common.model.ValidationResponse;
import tech.noetzold.zta.validation_api.model.ValidateRequest;
import tech.noetzold.zta.validation_api.reference.ReferenceDataHolder;
import tech.noetzold.zta.validation_api.reference.ReferenceDataSnapshot;
import tech.noetzold.zta.validation_api.service.ValidationService;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/validation")
public class ValidationController {

    private final ValidationService service;
    private final ReferenceDataHolder referenceData;

    public ValidationController(ValidationService service, ReferenceDataHolder referenceData) {
        this.service = service;
        this.referenceData = referenceData;
    }

    @Tag(name = "Validation")
    @Operation(summary = "Validate a signal bundle into a weighted vector with anomaly reasons")
    @PostMapping("/validate")
    public ValidationResponse validate(@RequestBody ValidateRequest request) {
        return service.validate(request.toBundle());
    }

    @Tag(name = "Reference")
    @GetMapping("/reference/status")
    public Map<String, Object> referenceStatus() {
        return describe(referenceData.current());
    }

    @Tag(name = "Reference")
    @Operation(summary = "Reload every reference dataset and swap the new snapshot in")
    @PostMapping("/reference/reload")
    public Map<String, Object> reload() {
        return describe(referenceData.reload());
    }

    private static Map<String, Object> describe(ReferenceDataSnapshot snapshot) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("loaded", snapshot.status());
        out.put("sizes", snapshot.sizes());
        out.put("geoip_database", snapshot.geoIpDatabase());
        out.put("loaded_at", snapshot.loadedAt().toString());
        return out;
    }
}
