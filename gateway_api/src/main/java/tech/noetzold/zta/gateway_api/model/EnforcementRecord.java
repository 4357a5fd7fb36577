package tech.noetzold.zta.gateway_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;

/**
 * Audit row written once per decision. Never updated.
 */
@Entity
@Table(name = "enforcement_records", indexes = {
        @Index(name = "idx_enforcement_records_session", columnList = "session_id, created_at")
})
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnforcementRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonProperty("session_id")
    @Column(name = "session_id", length = 120, nullable = false, updatable = false)
    private String sessionId;

    @Column(name = "risk", nullable = false, updatable = false)
    private double risk;

    @Column(name = "decision", length = 20, nullable = false, updatable = false)
    private String decision;

    @Column(name = "enforcement", length = 20, nullable = false, updatable = false)
    private String enforcement;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "reasons", columnDefinition = "jsonb", updatable = false)
    private List<String> reasons;

    @JsonProperty("stride_categories")
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "stride_categories", columnDefinition = "jsonb", updatable = false)
    private List<String> strideCategories;

    @Column(name = "confidence", updatable = false)
    private Double confidence;

    @JsonProperty("fail_safe")
    @Column(name = "fail_safe", nullable = false, updatable = false)
    private boolean failSafe;

    @JsonProperty("failure_detail")
    @Column(name = "failure_detail", length = 200, updatable = false)
    private String failureDetail;

    @JsonProperty("created_at")
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
