package tech.noetzold.zta.gateway_api.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.zta.common.model.AlertIngestRequest;
import tech.noetzold.zta.common.model.AlertSeverity;
import tech.noetzold.zta.common.model.RiskAssessment;
import tech.noetzold.zta.gateway_api.client.SiemServiceClient;
import tech.noetzold.zta.gateway_api.config.GatewayProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Feeds risky decisions back into the alert store so later attempts in the same
 * session see them in their alert counts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertEmitter {

    static final String SOURCE = "enforcement-gateway";

    private final SiemServiceClient siemClient;
    private final GatewayProperties props;

    /** @return whether an alert was emitted and accepted */
    public boolean emitIfRisky(RiskAssessment assessment) {
        if (assessment.risk() < props.getAlertThreshold()) {
            return false;
        }
        AlertSeverity severity = assessment.risk() >= props.getHighSeverityRisk()
                ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("risk", assessment.risk());
        raw.put("decision", assessment.decision().name());
        raw.put("confidence", assessment.confidence());
        raw.put("stride_categories", assessment.strideCategories());

        boolean accepted = siemClient.ingest(new AlertIngestRequest(
                assessment.sessionId(), severity, assessment.dominantStride(), SOURCE, raw));
        if (accepted) {
            log.info("Alert emitted session={} severity={} stride={}",
                    assessment.sessionId(), severity.label(), assessment.dominantStride());
        } else {
            log.warn("Alert for session={} was not accepted by the alert store", assessment.sessionId());
        }
        return accepted;
    }
}
