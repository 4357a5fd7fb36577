package tech.noetzold.zta.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Authoritative output of the trust scorer.
 */
public record RiskAssessment(
        @JsonProperty("session_id") String sessionId,
        double risk,
        TrustDecision decision,
        @JsonProperty("stride_categories") Set<StrideCategory> strideCategories,
        double confidence,
        @JsonProperty("dominant_stride") StrideCategory dominantStride
) {

    public RiskAssessment {
        if (Double.isNaN(risk) || risk < 0.0 || risk > 1.0) {
            throw new IllegalArgumentException("risk must be within [0,1]: " + risk);
        }
        if (decision == null) {
            throw new IllegalArgumentException("decision is required");
        }
        strideCategories = (strideCategories == null || strideCategories.isEmpty())
                ? Collections.unmodifiableSet(EnumSet.noneOf(StrideCategory.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(strideCategories));
        if (dominantStride == null) {
            dominantStride = StrideCategory.INFORMATION_DISCLOSURE;
        }
    }
}
