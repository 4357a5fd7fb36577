package tech.noetzold.zta.siem_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.zta.siem_api.model.SiemAlert;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SiemAlertRepository extends JpaRepository<SiemAlert, Long> {

    long countBySessionIdAndSeverityAndCreatedAtGreaterThanEqual(String sessionId, String severity, Instant since);

    List<SiemAlert> findBySessionIdOrderByCreatedAtDesc(String sessionId);

    Optional<SiemAlert> findFirstByExternalId(String externalId);
}
