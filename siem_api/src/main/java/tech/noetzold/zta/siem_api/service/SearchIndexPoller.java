package tech.noetzold.zta.siem_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import tech.noetzold.zta.siem_api.config.SiemProperties;

import java.util.List;
import java.util.Map;

/**
 * Reads recent step-up and deny decisions back from the search index and stores each
 * one as an alert. Hits already stored are skipped by their document id, so overlapping
 * look-back windows are harmless.
 */
@Slf4j
@Component
public class SearchIndexPoller {

    static final List<String> ENFORCED = List.of("MFA_STEP_UP", "DENY", "BLOCK");

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final SiemProperties props;
    private final ElasticEventTranslator translator;
    private final AlertIngestService ingest;

    public SearchIndexPoller(@Qualifier("searchIndexWebClient") WebClient webClient,
                             SiemProperties props,
                             ElasticEventTranslator translator,
                             AlertIngestService ingest) {
        this.webClient = webClient;
        this.props = props;
        this.translator = translator;
        this.ingest = ingest;
    }

    @Scheduled(fixedDelayString = "${zta.siem.poller.interval:PT20S}",
            initialDelayString = "${zta.siem.poller.interval:PT20S}")
    public void scheduledPoll() {
        if (!props.getPoller().isEnabled()) {
            return;
        }
        try {
            int stored = pollOnce();
            if (stored > 0) {
                log.info("Search index poll stored {} new alerts", stored);
            }
        } catch (RuntimeException e) {
            log.error("Search index poll failed", e);
        }
    }

    /**
     * One pass over every configured index. A failing index is logged and the rest
     * are still read.
     *
     * @return number of alerts newly stored
     */
    public int pollOnce() {
        int stored = 0;
        for (String index : props.getPoller().getIndexes()) {
            if (index == null || index.isBlank()) continue;
            try {
                stored += pollIndex(index.trim());
            } catch (RuntimeException e) {
                log.warn("Search index poll of {} failed: {}", index, e.toString());
            }
        }
        return stored;
    }

    private int pollIndex(String index) {
        Map<String, Object> response = webClient.post()
                .uri("/{index}/_search", index)
                .bodyValue(query())
                .retrieve()
                .bodyToMono(JSON_OBJECT)
                .timeout(props.getPoller().getTimeout())
                .block();
        int stored = 0;
        for (Map<String, Object> hit : hits(response)) {
            IngestOutcome outcome = ingest.ingest(translator.fromIndexHit(index, hit));
            if (!outcome.duplicate()) stored++;
        }
        return stored;
    }

    Map<String, Object> query() {
        SiemProperties.Poller p = props.getPoller();
        Map<String, Object> window = Map.of("range", Map.of("@timestamp",
                Map.of("gte", "now-" + p.getLookback(), "lte", "now")));
        Map<String, Object> enforced = Map.of("bool", Map.of(
                "should", List.of(
                        Map.of("terms", Map.of("enforcement.keyword", ENFORCED)),
                        Map.of("terms", Map.of("enforcement", ENFORCED))),
                "minimum_should_match", 1));
        return Map.of(
                "size", p.getBatchSize(),
                "sort", List.of(Map.of("@timestamp", Map.of("order", "asc"))),
                "query", Map.of("bool", Map.of("filter", List.of(window, enforced))));
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> hits(Map<String, Object> response) {
        if (response == null) return List.of();
        Object outer = response.get("hits");
        if (!(outer instanceof Map<?, ?> o)) return List.of();
        Object inner = o.get("hits");
        if (!(inner instanceof List<?> list)) return List.of();
        return list.stream()
                .filter(h -> h instanceof Map<?, ?>)
                .map(h -> (Map<String, Object>) h)
                .toList();
    }
}
