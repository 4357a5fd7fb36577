package tech.noetzold.zta.siem_api.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import tech.noetzold.zta.common.model.AlertIngestRequest;
import tech.noetzold.zta.common.model.AlertSeverity;
import tech.noetzold.zta.common.model.AlertWindowCount;
import tech.noetzold.zta.common.model.StrideCategory;
import tech.noetzold.zta.siem_api.config.SiemProperties;
import tech.noetzold.zta.siem_api.model.SiemAlert;
import tech.noetzold.zta.siem_api.service.AlertAggregationService;
import tech.noetzold.zta.siem_api.service.AlertIngestService;
import tech.noetzold.zta.siem_api.service.ElasticEventTranslator;
import tech.noetzold.zta.siem_api.service.IngestOutcome;

import java.time.Instant;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SiemControllerTest {

    @Mock
    private AlertAggregationService aggregation;

    @Mock
    private AlertIngestService ingest;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        SiemProperties props = new SiemProperties();
        mvc = MockMvcBuilders.standaloneSetup(new SiemController(aggregation, ingest,
                        new ElasticEventTranslator(props), props))
                .setControllerAdvice(new ErrorHandler())
                .build();
    }

    @Test
    @DisplayName("Aggregate uses the configured default window")
    void aggregateDefaultWindow() throws Exception {
        when(aggregation.countRecent("s1", 15)).thenReturn(new AlertWindowCount("s1", 1, 2, 15));

        mvc.perform(get("/siem/aggregate").param("session_id", "s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value("s1"))
                .andExpect(jsonPath("$.high").value(1))
                .andExpect(jsonPath("$.medium").value(2))
                .andExpect(jsonPath("$.window_minutes").value(15));
    }

    @Test
    @DisplayName("A non-positive window is a bad request")
    void aggregateRejectsZeroWindow() throws Exception {
        when(aggregation.countRecent("s1", 0)).thenThrow(new IllegalArgumentException("minutes must be > 0, got 0"));

        mvc.perform(get("/siem/aggregate").param("session_id", "s1").param("minutes", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("An unreachable store surfaces as 503")
    void storeUnavailable() throws Exception {
        when(aggregation.countRecent("s1", 15)).thenThrow(new DataAccessResourceFailureException("down"));

        mvc.perform(get("/siem/aggregate").param("session_id", "s1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"));
    }

    @Test
    @DisplayName("Ingest parses severity and stride leniently")
    void ingestParsesLabels() throws Exception {
        when(ingest.ingest(any())).thenReturn(IngestOutcome.stored(SiemAlert.builder()
                .id(7L).sessionId("s1").severity("high").stride("DoS").source("gateway")
                .createdAt(Instant.parse("2026-10-15T12:00:00Z")).build()));

        mvc.perform(post("/siem/ingest").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"s1\",\"severity\":\"CRITICAL\",\"stride\":\"dos\",\"source\":\"gateway\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.session_id").value("s1"))
                .andExpect(jsonPath("$.severity").value("high"));

        verify(ingest).ingest(new AlertIngestRequest("s1", AlertSeverity.HIGH, StrideCategory.DENIAL_OF_SERVICE,
                "gateway", null));
    }

    @Test
    @DisplayName("Re-posting a stored document answers 200 with the earlier alert")
    void ingestDuplicate() throws Exception {
        when(ingest.ingest(any())).thenReturn(IngestOutcome.duplicateOf(SiemAlert.builder()
                .id(3L).sessionId("s1").severity("high").stride("Spoofing").externalId("doc-1").build()));

        mvc.perform(post("/siem/ingest").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"s1\",\"severity\":\"high\",\"raw\":{\"_id\":\"doc-1\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(3))
                .andExpect(jsonPath("$.external_id").value("doc-1"));
    }

    @Test
    @DisplayName("A Kibana alert webhook takes severity, technique and user from the payload")
    void elasticWebhook() throws Exception {
        when(ingest.ingest(any())).thenReturn(IngestOutcome.stored(SiemAlert.builder()
                .id(11L).sessionId("alice").severity("high").stride("Spoofing").source("elastic").build()));

        mvc.perform(post("/siem/ingest/elastic").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kibana\":{\"alert\":{\"severity\":\"critical\"}},"
                                + "\"threat\":{\"technique\":\"spoofing\"},"
                                + "\"user\":{\"name\":\"alice\"},\"_id\":\"k-77\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.source").value("elastic"));

        verify(ingest).ingest(argThat(req -> req.sessionId().equals("alice")
                && req.severity() == AlertSeverity.HIGH
                && req.stride() == StrideCategory.SPOOFING
                && "elastic".equals(req.source())
                && "k-77".equals(req.raw().get("_id"))));
    }

    @Test
    @DisplayName("A bare webhook is a low InformationDisclosure alert for an unknown session")
    void elasticWebhookDefaults() throws Exception {
        when(ingest.ingest(any())).thenReturn(IngestOutcome.stored(SiemAlert.builder().id(12L).build()));

        mvc.perform(post("/siem/ingest/elastic").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rule\":{\"name\":\"noisy\"}}"))
                .andExpect(status().isCreated());

        verify(ingest).ingest(new AlertIngestRequest("sess-unknown", AlertSeverity.LOW,
                StrideCategory.INFORMATION_DISCLOSURE, "elastic", Map.of("rule", Map.of("name", "noisy"))));
    }

    @Test
    @DisplayName("A webhook body that is not a JSON object is a bad request")
    void elasticWebhookNotAnObject() throws Exception {
        mvc.perform(post("/siem/ingest/elastic").contentType(MediaType.APPLICATION_JSON).content("[1,2]"))
                .andExpect(status().isBadRequest());
    }
}
