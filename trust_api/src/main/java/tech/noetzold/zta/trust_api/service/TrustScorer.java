package tech.noetzold.zta.trust_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.zta.common.model.AnomalyReason;
import tech.noetzold.zta.common.model.RiskAssessment;
import tech.noetzold.zta.common.model.SiemCounts;
import tech.noetzold.zta.common.model.SignalType;
import tech.noetzold.zta.common.model.StrideCategory;
import tech.noetzold.zta.common.model.TrustDecision;
import tech.noetzold.zta.common.model.ValidatedVector;
import tech.noetzold.zta.trust_api.config.TrustProperties;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic risk scoring over a validated vector and recent alert pressure.
 * <p>
 * Each reason adds its increment to a base risk, scaled by the weight of the signal it
 * describes when it describes one. The sum is dampened or amplified by how much evidence
 * the vector carries, then alert counts are added and the result is clamped to [0,1].
 * Decisions use half-open intervals: risk below the allow threshold allows, risk at or
 * above the deny threshold denies, everything in between steps up.
 */
@Slf4j
@Service
public class TrustScorer {

    private final TrustProperties props;
    private final Map<AnomalyReason, Double> increments;

    public TrustScorer(TrustProperties props) {
        this.props = props;
        this.increments = props.increments();
    }

    public RiskAssessment score(ValidatedVector vector, SiemCounts siem) {
        SiemCounts alerts = siem != null ? siem : new SiemCounts(0, 0);

        double signalRisk = props.getBaseRisk();
        Set<StrideCategory> categories = EnumSet.noneOf(StrideCategory.class);
        StrideCategory dominant = null;
        double dominantContribution = 0.0;
        for (AnomalyReason reason : vector.reasons()) {
            double contribution = contribution(reason, vector);
            signalRisk += contribution;
            categories.add(reason.stride());
            if (contribution > dominantContribution) {
                dominantContribution = contribution;
                dominant = reason.stride();
            }
        }

        double confidence = round4(confidence(vector));
        double risk = round4(clamp01(signalRisk * confidenceFactor(confidence)
                + alerts.high() * props.getSiemHighBump()
                + alerts.medium() * props.getSiemMediumBump()));
        TrustDecision decision = decide(risk);

        log.info("Scored session={} risk={} decision={} confidence={} reasons={} siem={}",
                vector.sessionId(), risk, decision, confidence, vector.reasons(), alerts);
        return new RiskAssessment(vector.sessionId(), risk, decision, categories,
                confidence, dominant);
    }

    double contribution(AnomalyReason reason, ValidatedVector vector) {
        double increment = increments.get(reason);
        SignalType linked = reason.linkedSignal();
        if (linked == null) {
            return increment;
        }
        return increment * (0.5 + 0.5 * vector.weightOf(linked));
    }

    /** Blend of total weight mass and how many signal types carry any weight. */
    double confidence(ValidatedVector vector) {
        double mass = 0.0;
        int covered = 0;
        for (Double w : vector.weights().values()) {
            mass += w;
            if (w > 0.0) covered++;
        }
        double massTerm = Math.min(1.0, mass / props.getFullWeightMass());
        double breadthTerm = (double) covered / SignalType.values().length;
        return clamp01(0.6 * massTerm + 0.4 * breadthTerm);
    }

    double confidenceFactor(double confidence) {
        if (confidence >= props.getHighConfidence()) return props.getHighConfidenceFactor();
        if (confidence <= props.getLowConfidence()) return props.getLowConfidenceFactor();
        return 1.0;
    }

    TrustDecision decide(double risk) {
        if (risk < props.getAllowThreshold()) return TrustDecision.ALLOW;
        if (risk >= props.getDenyThreshold()) return TrustDecision.DENY;
        return TrustDecision.STEP_UP;
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static double round4(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
