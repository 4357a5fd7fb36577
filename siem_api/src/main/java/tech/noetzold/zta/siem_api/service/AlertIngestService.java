package tech.noetzold.zta.siem_api.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tech.noetzold.zta.common.model.AlertIngestRequest;
import tech.noetzold.zta.common.model.AlertSeverity;
import tech.noetzold.zta.common.model.StrideCategory;
import tech.noetzold.zta.siem_api.model.SiemAlert;
import tech.noetzold.zta.siem_api.repository.SiemAlertRepository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AlertIngestService {

    private static final String DEFAULT_SOURCE = "external";
    static final String EXTERNAL_ID_KEY = "_id";

    private final SiemAlertRepository repository;
    private final SearchIndexMirror mirror;

    /**
     * Stores the alert unless one built from the same search-index document
     * ({@code raw._id}) already exists. Each repository call runs in its own
     * transaction so a lost insert race can still be answered as a duplicate.
     */
    public IngestOutcome ingest(AlertIngestRequest req) {
        if (req == null || req.sessionId() == null || req.sessionId().isBlank()) {
            throw new IllegalArgumentException("session_id is required");
        }
        Map<String, Object> raw = req.raw() != null ? req.raw() : Map.of();
        String externalId = externalId(raw);
        if (externalId != null) {
            Optional<SiemAlert> existing = repository.findFirstByExternalId(externalId);
            if (existing.isPresent()) {
                log.debug("Alert for document {} already stored as id={}", externalId, existing.get().getId());
                return IngestOutcome.duplicateOf(existing.get());
            }
        }

        AlertSeverity severity = req.severity() != null ? req.severity() : AlertSeverity.MEDIUM;
        StrideCategory stride = req.stride() != null ? req.stride() : StrideCategory.INFORMATION_DISCLOSURE;

        SiemAlert alert = SiemAlert.builder()
                .sessionId(req.sessionId().trim())
                .severity(severity.label())
                .stride(stride.label())
                .source(req.source() != null && !req.source().isBlank() ? req.source().trim() : DEFAULT_SOURCE)
                .externalId(externalId)
                .raw(raw)
                .build();

        SiemAlert saved;
        try {
            saved = repository.save(alert);
        } catch (DataIntegrityViolationException e) {
            if (externalId == null) throw e;
            SiemAlert winner = repository.findFirstByExternalId(externalId).orElseThrow(() -> e);
            log.debug("Concurrent insert for document {} kept id={}", externalId, winner.getId());
            return IngestOutcome.duplicateOf(winner);
        }
        log.info("Alert stored id={} session={} severity={} stride={} source={}",
                saved.getId(), saved.getSessionId(), saved.getSeverity(), saved.getStride(), saved.getSource());
        mirror.mirror(saved);
        return IngestOutcome.stored(saved);
    }

    @Transactional(readOnly = true)
    public List<SiemAlert> list(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session_id is required");
        }
        return repository.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    static String externalId(Map<String, Object> raw) {
        Object id = raw.get(EXTERNAL_ID_KEY);
        if (id == null) return null;
        String s = String.valueOf(id).trim();
        return s.isEmpty() ? null : s;
    }
}
