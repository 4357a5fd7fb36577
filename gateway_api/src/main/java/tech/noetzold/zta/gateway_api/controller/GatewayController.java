package tech.noetzold.zta.gateway_api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.zta.common.model.SignalBundle;
import tech.noetzold.zta.gateway_api.model.DecisionResponse;
import tech.noetzold.zta.gateway_api.model.EnforcementRecord;
import tech.noetzold.zta.gateway_api.service.EnforcementGatewayService;

import java.util.List;

@RestController
@RequestMapping("/gateway")
public class GatewayController {

    private final EnforcementGatewayService service;

    public GatewayController(EnforcementGatewayService service) {
        this.service = service;
    }

    @Tag(name = "Decision")
    @Operation(summary = "Decide allow, step-up or deny for one authentication attempt")
    @PostMapping("/decision")
    public DecisionResponse decide(@RequestBody SignalBundle bundle) {
        return service.decide(bundle);
    }

    @Tag(name = "Audit")
    @GetMapping("/records")
    public List<EnforcementRecord> records(@RequestParam("session_id") String sessionId) {
        return service.records(sessionId);
    }
}
