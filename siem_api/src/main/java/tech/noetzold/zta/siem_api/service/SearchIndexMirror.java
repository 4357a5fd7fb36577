package tech.noetzold.zta.siem_api.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.zta.siem_api.config.SiemProperties;
import tech.noetzold.zta.siem_api.model.SiemAlert;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies stored alerts into the search index. Fire-and-forget: failures are logged, never raised.
 */
@Component
public class SearchIndexMirror {

    private static final Logger logger = LoggerFactory.getLogger(SearchIndexMirror.class);

    private final WebClient webClient;
    private final SiemProperties props;

    public SearchIndexMirror(@Qualifier("searchIndexWebClient") WebClient webClient, SiemProperties props) {
        this.webClient = webClient;
        this.props = props;
    }

    public void mirror(SiemAlert alert) {
        SiemProperties.Mirror m = props.getMirror();
        if (!m.isEnabled()) {
            return;
        }
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("@timestamp", alert.getCreatedAt() != null ? alert.getCreatedAt().toString() : null);
        doc.put("session_id", alert.getSessionId());
        doc.put("severity", alert.getSeverity());
        doc.put("stride", alert.getStride());
        doc.put("source", alert.getSource());
        doc.put("raw", alert.getRaw());

        webClient.post()
                .uri("/{index}/_doc", m.getIndex())
                .bodyValue(doc)
                .retrieve()
                .toBodilessEntity()
                .timeout(Duration.ofMillis(m.getTimeoutMs()))
                .onErrorResume(e -> {
                    logger.warn("Alert mirror to index {} failed: {}", m.getIndex(), e.getMessage());
                    return Mono.empty();
                })
                .subscribe();
    }
}
