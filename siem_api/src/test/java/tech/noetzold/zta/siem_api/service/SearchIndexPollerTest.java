package tech.noetzold.zta.siem_api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.zta.common.model.AlertIngestRequest;
import tech.noetzold.zta.common.model.AlertSeverity;
import tech.noetzold.zta.common.model.StrideCategory;
import tech.noetzold.zta.siem_api.config.SiemProperties;
import tech.noetzold.zta.siem_api.model.SiemAlert;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchIndexPollerTest {

    private static final String TWO_HITS = """
            {"hits":{"hits":[
              {"_id":"a1","_source":{"session_id":"s1","risk":0.9,"decision":"DENY","enforcement":"DENY",
                                     "reasons":["TLS_ANOMALY"]}},
              {"_id":"a2","_source":{"session_id":"s2","decision":"STEP_UP","enforcement":"MFA_STEP_UP",
                                     "reasons":["LOCATION_MISMATCH"]}}
            ]}}
            """;

    @Mock
    private AlertIngestService ingest;

    private SiemProperties props;
    private List<String> paths;

    @BeforeEach
    void setUp() {
        props = new SiemProperties();
        props.getMirror().setHost("http://es");
        props.getPoller().setEnabled(true);
        paths = new ArrayList<>();
    }

    private SearchIndexPoller poller(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder().baseUrl("http://es").exchangeFunction(req -> {
            paths.add(req.url().getPath());
            return exchange.exchange(req);
        }).build();
        return new SearchIndexPoller(webClient, props, new ElasticEventTranslator(props), ingest);
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    private static IngestOutcome stored() {
        return IngestOutcome.stored(SiemAlert.builder().id(1L).build());
    }

    @Test
    @DisplayName("Enforced decisions in the index become alerts with derived severity and stride")
    void storesHits() {
        when(ingest.ingest(any())).thenReturn(stored());

        int stored = poller(req -> json(HttpStatus.OK, TWO_HITS)).pollOnce();

        assertEquals(2, stored);
        assertEquals(List.of("/mfa-events*/_search"), paths);
        ArgumentCaptor<AlertIngestRequest> captor = ArgumentCaptor.forClass(AlertIngestRequest.class);
        verify(ingest, times(2)).ingest(captor.capture());
        AlertIngestRequest deny = captor.getAllValues().get(0);
        assertEquals("s1", deny.sessionId());
        assertEquals(AlertSeverity.HIGH, deny.severity());
        assertEquals(StrideCategory.TAMPERING, deny.stride());
        assertEquals("es:mfa-events*", deny.source());
        assertEquals("a1", deny.raw().get("_id"));
        AlertIngestRequest stepUp = captor.getAllValues().get(1);
        assertEquals(AlertSeverity.MEDIUM, stepUp.severity());
        assertEquals(StrideCategory.SPOOFING, stepUp.stride());
    }

    @Test
    @DisplayName("Hits already stored on an earlier run are not counted again")
    void skipsDuplicates() {
        when(ingest.ingest(any())).thenReturn(
                IngestOutcome.duplicateOf(SiemAlert.builder().id(1L).build()), stored());

        assertEquals(1, poller(req -> json(HttpStatus.OK, TWO_HITS)).pollOnce());
    }

    @Test
    @DisplayName("A failing index does not stop the others from being read")
    void failingIndex() {
        props.getPoller().setIndexes(List.of("broken", "mfa-events*"));
        when(ingest.ingest(any())).thenReturn(stored());

        int stored = poller(req -> req.url().getPath().startsWith("/broken")
                ? json(HttpStatus.INTERNAL_SERVER_ERROR, "{}")
                : json(HttpStatus.OK, TWO_HITS)).pollOnce();

        assertEquals(2, stored);
        assertEquals(List.of("/broken/_search", "/mfa-events*/_search"), paths);
    }

    @Test
    @DisplayName("An index slower than the poll timeout is skipped")
    void slowIndex() {
        props.getPoller().setTimeout(Duration.ofMillis(50));

        assertEquals(0, poller(req -> Mono.never()).pollOnce());
        verifyNoInteractions(ingest);
    }

    @Test
    @DisplayName("A response without hits stores nothing")
    void noHits() {
        assertEquals(0, poller(req -> json(HttpStatus.OK, "{\"hits\":{\"total\":0}}")).pollOnce());
        verifyNoInteractions(ingest);
    }

    @Test
    @DisplayName("A disabled poller never calls the index")
    void disabled() {
        props.getPoller().setEnabled(false);

        poller(req -> json(HttpStatus.OK, TWO_HITS)).scheduledPoll();

        assertTrue(paths.isEmpty());
        verifyNoInteractions(ingest);
    }

    @Test
    @DisplayName("The search asks for step-up and deny events inside the look-back window")
    @SuppressWarnings("unchecked")
    void query() {
        props.getPoller().setLookback("5m");
        props.getPoller().setBatchSize(50);

        Map<String, Object> q = poller(req -> Mono.never()).query();

        assertEquals(50, q.get("size"));
        Map<String, Object> bool = (Map<String, Object>) ((Map<String, Object>) q.get("query")).get("bool");
        List<Map<String, Object>> filter = (List<Map<String, Object>>) bool.get("filter");
        Map<String, Object> range = (Map<String, Object>) ((Map<String, Object>) filter.get(0).get("range")).get("@timestamp");
        assertEquals("now-5m", range.get("gte"));
        assertTrue(filter.get(1).toString().contains("MFA_STEP_UP"));
        assertTrue(filter.get(1).toString().contains("DENY"));
    }
}
