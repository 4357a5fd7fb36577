package tech.noetzold.zta.siem_api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.zta.common.model.AlertIngestRequest;
import tech.noetzold.zta.common.model.AlertWindowCount;
import tech.noetzold.zta.siem_api.config.SiemProperties;
import tech.noetzold.zta.siem_api.model.SiemAlert;
import tech.noetzold.zta.siem_api.service.AlertAggregationService;
import tech.noetzold.zta.siem_api.service.AlertIngestService;
import tech.noetzold.zta.siem_api.service.ElasticEventTranslator;
import tech.noetzold.zta.siem_api.service.IngestOutcome;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/siem")
public class SiemController {

    private final AlertAggregationService aggregation;
    private final AlertIngestService ingest;
    private final ElasticEventTranslator elastic;
    private final SiemProperties props;

    public SiemController(AlertAggregationService aggregation,
                          AlertIngestService ingest,
                          ElasticEventTranslator elastic,
                          SiemProperties props) {
        this.aggregation = aggregation;
        this.ingest = ingest;
        this.elastic = elastic;
        this.props = props;
    }

    @Tag(name = "Aggregation")
    @Operation(summary = "High and medium alert counts for a session inside a trailing window")
    @GetMapping("/aggregate")
    public AlertWindowCount aggregate(@RequestParam("session_id") String sessionId,
                                      @RequestParam(value = "minutes", required = false) Integer minutes) {
        return aggregation.countRecent(sessionId, minutes != null ? minutes : props.getWindowMinutes());
    }

    @Tag(name = "Alerts")
    @Operation(summary = "Store an alert; 200 with the earlier row when its raw._id was already stored")
    @PostMapping("/ingest")
    public ResponseEntity<SiemAlert> ingest(@RequestBody AlertIngestRequest request) {
        return respond(ingest.ingest(request));
    }

    @Tag(name = "Alerts")
    @Operation(summary = "Kibana/Elastic alert webhook")
    @PostMapping("/ingest/elastic")
    public ResponseEntity<SiemAlert> ingestElastic(@RequestBody Map<String, Object> payload) {
        return respond(ingest.ingest(elastic.fromWebhook(payload)));
    }

    private static ResponseEntity<SiemAlert> respond(IngestOutcome outcome) {
        return ResponseEntity.status(outcome.duplicate() ? HttpStatus.OK : HttpStatus.CREATED).body(outcome.alert());
    }

    @Tag(name = "Alerts")
    @GetMapping("/alerts")
    public List<SiemAlert> alerts(@RequestParam("session_id") String sessionId) {
        return ingest.list(sessionId);
    }
}
