package tech.noetzold.zta.gateway_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.zta.gateway_api.model.EnforcementRecord;

import java.util.List;

public interface EnforcementRecordRepository extends JpaRepository<EnforcementRecord, Long> {

    List<EnforcementRecord> findBySessionIdOrderByCreatedAtDesc(String sessionId);
}
