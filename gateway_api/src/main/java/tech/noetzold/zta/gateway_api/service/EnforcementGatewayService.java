package tech.noetzold.zta.gateway_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.ott.OneTimeToken;
import org.springframework.stereotype.Service;
import tech.noetzold.zta.common.model.AlertWindowCount;
import tech.noetzold.zta.common.model.AnomalyReason;
import tech.noetzold.zta.common.model.Enforcement;
import tech.noetzold.zta.common.model.RiskAssessment;
import tech.noetzold.zta.common.model.ScoreRequest;
import tech.noetzold.zta.common.model.SignalBundle;
import tech.noetzold.zta.common.model.StrideCategory;
import tech.noetzold.zta.common.model.TrustDecision;
import tech.noetzold.zta.common.model.ValidatedVector;
import tech.noetzold.zta.common.model.ValidationResponse;
import tech.noetzold.zta.gateway_api.client.SiemServiceClient;
import tech.noetzold.zta.gateway_api.client.TelemetryPublisher;
import tech.noetzold.zta.gateway_api.client.TrustServiceClient;
import tech.noetzold.zta.gateway_api.client.ValidationServiceClient;
import tech.noetzold.zta.gateway_api.config.GatewayProperties;
import tech.noetzold.zta.gateway_api.model.DecisionCancelledException;
import tech.noetzold.zta.gateway_api.model.DecisionResponse;
import tech.noetzold.zta.gateway_api.model.EnforcementRecord;
import tech.noetzold.zta.gateway_api.model.PersistenceStatus;
import tech.noetzold.zta.gateway_api.repository.EnforcementRecordRepository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one authentication attempt through validation, alert aggregation and trust
 * scoring, then enforces, records and reports the outcome.
 * <p>
 * Any upstream stage that fails, times out or answers without a body turns the
 * attempt into a fail-safe DENY at risk 1.0. A cancelled attempt persists nothing.
 */
@Slf4j
@Service
public class EnforcementGatewayService {

    static final double FAIL_SAFE_RISK = 1.0;

    private final ValidationServiceClient validationClient;
    private final SiemServiceClient siemClient;
    private final TrustServiceClient trustClient;
    private final StepUpChallengeIssuer challengeIssuer;
    private final AlertEmitter alertEmitter;
    private final TelemetryPublisher telemetry;
    private final EnforcementRecordRepository recordRepo;
    private final GatewayProperties props;

    public EnforcementGatewayService(ValidationServiceClient validationClient,
                                     SiemServiceClient siemClient,
                                     TrustServiceClient trustClient,
                                     StepUpChallengeIssuer challengeIssuer,
                                     AlertEmitter alertEmitter,
                                     TelemetryPublisher telemetry,
                                     EnforcementRecordRepository recordRepo,
                                     GatewayProperties props) {
        this.validationClient = validationClient;
        this.siemClient = siemClient;
        this.trustClient = trustClient;
        this.challengeIssuer = challengeIssuer;
        this.alertEmitter = alertEmitter;
        this.telemetry = telemetry;
        this.recordRepo = recordRepo;
        this.props = props;
    }

    public DecisionResponse decide(SignalBundle request) {
        SignalBundle bundle = ensureSession(request);
        String sessionId = bundle.sessionId();
        log.info("Decision started session={} signals={} label={}", sessionId, bundle.signals().keySet(), bundle.label());
        checkCancelled("start");

        Optional<ValidationResponse> validation = validationClient.validate(bundle);
        checkCancelled("validation");
        if (validation.isEmpty()) {
            return failSafe(sessionId, "validation unavailable", List.of());
        }
        ValidatedVector vector = validation.get().validated();
        log.info("Validation done session={} weights={} reasons={}", sessionId, vector.weights(), vector.reasons());

        Optional<AlertWindowCount> alerts = siemClient.aggregate(sessionId, props.getAlertWindowMinutes());
        checkCancelled("siem");
        if (alerts.isEmpty()) {
            return failSafe(sessionId, "siem unavailable", vector.reasons());
        }
        log.info("Alert counts session={} high={} medium={}", sessionId, alerts.get().high(), alerts.get().medium());

        // the bundle carries the gateway's session id even if validation echoed none
        ValidatedVector scored = new ValidatedVector(vector.vector().withSessionId(sessionId),
                vector.weights(), vector.reasons());
        Optional<RiskAssessment> scoredAssessment = trustClient.score(ScoreRequest.of(scored, alerts.get()));
        checkCancelled("trust");
        if (scoredAssessment.isEmpty()) {
            return failSafe(sessionId, "trust unavailable", vector.reasons());
        }
        RiskAssessment assessment = scoredAssessment.get();
        Enforcement enforcement = Enforcement.from(assessment.decision());
        log.info("Trust decision session={} risk={} decision={} enforcement={}",
                sessionId, assessment.risk(), assessment.decision(), enforcement);

        checkCancelled("persistence");
        // past the last cancellation point
        OneTimeToken challenge = enforcement == Enforcement.MFA_STEP_UP ? challengeIssuer.issue(sessionId) : null;

        EnforcementRecord record = EnforcementRecord.builder()
                .sessionId(sessionId)
                .risk(assessment.risk())
                .decision(assessment.decision().name())
                .enforcement(enforcement.name())
                .reasons(names(vector.reasons()))
                .strideCategories(labels(assessment.strideCategories()))
                .confidence(assessment.confidence())
                .failSafe(false)
                .build();
        PersistenceStatus persistence = persist(record);

        alertEmitter.emitIfRisky(assessment);
        publishTelemetry(sessionId, assessment.risk(), assessment.decision(), enforcement, vector.reasons(), false);

        return new DecisionResponse(sessionId, enforcement, assessment.risk(), assessment.decision(),
                vector.reasons(), assessment.strideCategories(), assessment.dominantStride(),
                assessment.confidence(), false, null,
                challenge != null ? challenge.getTokenValue() : null,
                challenge != null ? challenge.getExpiresAt() : null,
                persistence);
    }

    public List<EnforcementRecord> records(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session_id is required");
        }
        return recordRepo.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    private DecisionResponse failSafe(String sessionId, String detail, List<AnomalyReason> reasons) {
        log.error("Fail-safe DENY session={} cause={}", sessionId, detail);
        checkCancelled("persistence");
        EnforcementRecord record = EnforcementRecord.builder()
                .sessionId(sessionId)
                .risk(FAIL_SAFE_RISK)
                .decision(TrustDecision.DENY.name())
                .enforcement(Enforcement.DENY.name())
                .reasons(names(reasons))
                .strideCategories(List.of())
                .failSafe(true)
                .failureDetail(detail)
                .build();
        PersistenceStatus persistence = persist(record);
        publishTelemetry(sessionId, FAIL_SAFE_RISK, TrustDecision.DENY, Enforcement.DENY, reasons, true);
        return new DecisionResponse(sessionId, Enforcement.DENY, FAIL_SAFE_RISK, TrustDecision.DENY,
                reasons, Set.of(), null, null, true, detail, null, null, persistence);
    }

    private PersistenceStatus persist(EnforcementRecord record) {
        try {
            EnforcementRecord saved = recordRepo.save(record);
            log.info("EnforcementRecord saved id={} session={}", saved.getId(), saved.getSessionId());
            return PersistenceStatus.stored(saved.getId());
        } catch (Exception e) {
            log.warn("Error to persist EnforcementRecord for session {}", record.getSessionId(), e);
            return PersistenceStatus.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void publishTelemetry(String sessionId, double risk, TrustDecision decision, Enforcement enforcement,
                                  List<AnomalyReason> reasons, boolean failSafe) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("@timestamp", Instant.now().toString());
        event.put("session_id", sessionId);
        event.put("risk", risk);
        event.put("decision", decision.name());
        event.put("enforcement", enforcement.name());
        event.put("reasons", names(reasons));
        event.put("fail_safe", failSafe);
        telemetry.publish(event);
    }

    private static SignalBundle ensureSession(SignalBundle request) {
        SignalBundle bundle = request != null ? request : new SignalBundle(null, Map.of(), null);
        if (bundle.sessionId() != null && !bundle.sessionId().isBlank()) {
            return bundle;
        }
        return bundle.withSessionId("sess-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8));
    }

    private static void checkCancelled(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            log.info("Decision cancelled at stage={}", stage);
            throw new DecisionCancelledException(stage);
        }
    }

    private static List<String> names(List<AnomalyReason> reasons) {
        return reasons.stream().map(Enum::name).toList();
    }

    private static List<String> labels(Set<StrideCategory> categories) {
        return categories.stream().map(StrideCategory::label).toList();
    }
}
