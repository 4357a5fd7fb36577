package tech.noetzold.zta.trust_api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.noetzold.zta.common.model.RiskAssessment;
import tech.noetzold.zta.common.model.ScoreRequest;
import tech.noetzold.zta.trust_api.service.TrustScorer;

@RestController
@RequestMapping("/trust")
public class TrustController {

    private final TrustScorer scorer;

    public TrustController(TrustScorer scorer) {
        this.scorer = scorer;
    }

    @Tag(name = "Trust")
    @Operation(summary = "Score a validated vector plus recent alert counts into a risk and decision")
    @PostMapping("/score")
    public RiskAssessment score(@RequestBody ScoreRequest request) {
        return scorer.score(request.toValidatedVector(), request.siemOrEmpty());
    }
}
