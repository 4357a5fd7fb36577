package tech.noetzold.zta.gateway_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.noetzold.zta.common.model.AnomalyReason;
import tech.noetzold.zta.common.model.Enforcement;
import tech.noetzold.zta.common.model.StrideCategory;
import tech.noetzold.zta.common.model.TrustDecision;

import java.time.Instant;
import java.util.List;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionResponse(
        @JsonProperty("session_id") String sessionId,
        Enforcement enforcement,
        double risk,
        TrustDecision decision,
        List<AnomalyReason> reasons,
        @JsonProperty("stride_categories") Set<StrideCategory> strideCategories,
        @JsonProperty("dominant_stride") StrideCategory dominantStride,
        Double confidence,
        @JsonProperty("fail_safe") boolean failSafe,
        @JsonProperty("failure_detail") String failureDetail,
        @JsonProperty("challenge_token") String challengeToken,
        @JsonProperty("challenge_expires_at") Instant challengeExpiresAt,
        PersistenceStatus persistence
) {}
