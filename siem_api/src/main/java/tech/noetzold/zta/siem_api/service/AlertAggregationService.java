package tech.noetzold.zta.siem_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tech.noetzold.zta.common.model.AlertSeverity;
import tech.noetzold.zta.common.model.AlertWindowCount;
import tech.noetzold.zta.siem_api.repository.SiemAlertRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Counts recent high and medium alerts for a session. Nothing is cached; every call
 * reads the store, and concurrent inserts are tolerated without locking.
 */
@Slf4j
@Service
public class AlertAggregationService {

    private final SiemAlertRepository repository;
    private final Clock clock;

    public AlertAggregationService(SiemAlertRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public AlertWindowCount countRecent(String sessionId, int windowMinutes) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session_id is required");
        }
        if (windowMinutes <= 0) {
            throw new IllegalArgumentException("minutes must be > 0, got " + windowMinutes);
        }
        Instant since = clock.instant().minus(Duration.ofMinutes(windowMinutes));
        long high = repository.countBySessionIdAndSeverityAndCreatedAtGreaterThanEqual(
                sessionId, AlertSeverity.HIGH.label(), since);
        long medium = repository.countBySessionIdAndSeverityAndCreatedAtGreaterThanEqual(
                sessionId, AlertSeverity.MEDIUM.label(), since);
        log.info("Aggregated alerts session={} window={}m high={} medium={}", sessionId, windowMinutes, high, medium);
        return new AlertWindowCount(sessionId, high, medium, windowMinutes);
    }
}
