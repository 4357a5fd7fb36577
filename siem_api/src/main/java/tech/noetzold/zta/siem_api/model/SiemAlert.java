package tech.noetzold.zta.siem_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "siem_alerts", indexes = {
        @Index(name = "idx_siem_alerts_session_created", columnList = "session_id, created_at"),
        @Index(name = "uq_siem_alerts_external_id", columnList = "external_id", unique = true)
})
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SiemAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonProperty("session_id")
    @Column(name = "session_id", length = 120, nullable = false)
    private String sessionId;

    @Column(name = "stride", length = 40, nullable = false)
    private String stride;

    @Column(name = "severity", length = 10, nullable = false)
    private String severity; // low | medium | high

    @Column(name = "source", length = 80)
    private String source;

    /** Id of the search-index document this alert was built from; {@code raw._id}. */
    @JsonProperty("external_id")
    @Column(name = "external_id", length = 200)
    private String externalId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw", columnDefinition = "jsonb")
    private Map<String, Object> raw;

    @JsonProperty("created_at")
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
