package tech.noetzold.zta.gateway_api.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.zta.common.model.AlertIngestRequest;
import tech.noetzold.zta.common.model.AlertWindowCount;
import tech.noetzold.zta.gateway_api.config.GatewayProperties;

import java.util.Optional;

@Component
public class SiemServiceClient {

    private static final Logger logger = LoggerFactory.getLogger(SiemServiceClient.class);

    private final WebClient webClient;
    private final GatewayProperties props;

    public SiemServiceClient(@Qualifier("siemWebClient") WebClient siemWebClient, GatewayProperties props) {
        this.webClient = siemWebClient;
        this.props = props;
    }

    /** Recent alert counts, or empty when the alert store cannot be queried in time. */
    public Optional<AlertWindowCount> aggregate(String sessionId, int windowMinutes) {
        try {
            return webClient.get()
                    .uri(b -> b.path("/siem/aggregate")
                            .queryParam("session_id", sessionId)
                            .queryParam("minutes", windowMinutes)
                            .build())
                    .retrieve()
                    .bodyToMono(AlertWindowCount.class)
                    .timeout(props.getTimeouts().getSiem())
                    .onErrorResume(e -> {
                        logger.warn("Alert aggregation failed for session {}: {}", sessionId, e.toString());
                        return Mono.empty();
                    })
                    .blockOptional();
        } catch (Exception e) {
            Interrupts.restoreIfInterrupted(e);
            logger.warn("Alert aggregation aborted for session {}: {}", sessionId, e.toString());
            return Optional.empty();
        }
    }

    /** Posts an alert; returns whether the store accepted it. */
    public boolean ingest(AlertIngestRequest alert) {
        try {
            return webClient.post()
                    .uri("/siem/ingest")
                    .bodyValue(alert)
                    .exchangeToMono(resp -> resp.releaseBody().thenReturn(resp.statusCode().is2xxSuccessful()))
                    .timeout(props.getTimeouts().getSiem())
                    .onErrorResume(e -> {
                        logger.warn("Alert ingest failed for session {}: {}", alert.sessionId(), e.toString());
                        return Mono.just(false);
                    })
                    .blockOptional()
                    .orElse(false);
        } catch (Exception e) {
            Interrupts.restoreIfInterrupted(e);
            logger.warn("Alert ingest aborted for session {}: {}", alert.sessionId(), e.toString());
            return false;
        }
    }
}
