package tech.noetzold.zta.gateway_api.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.zta.gateway_api.config.GatewayProperties;

import java.util.Map;

/**
 * Indexes decision events into the search cluster. Never blocks the caller and never throws.
 */
@Component
public class TelemetryPublisher {

    private static final Logger logger = LoggerFactory.getLogger(TelemetryPublisher.class);

    private final WebClient webClient;
    private final GatewayProperties props;

    public TelemetryPublisher(@Qualifier("telemetryWebClient") WebClient telemetryWebClient, GatewayProperties props) {
        this.webClient = telemetryWebClient;
        this.props = props;
    }

    public void publish(Map<String, Object> event) {
        GatewayProperties.Telemetry t = props.getTelemetry();
        if (!t.isEnabled()) {
            return;
        }
        try {
            webClient.post()
                    .uri("/{index}/_doc", t.getIndex())
                    .bodyValue(event)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(t.getTimeout())
                    .onErrorResume(e -> {
                        logger.warn("Telemetry to index {} failed: {}", t.getIndex(), e.toString());
                        return Mono.empty();
                    })
                    .subscribe();
        } catch (RuntimeException e) {
            logger.warn("Telemetry to index {} not sent: {}", t.getIndex(), e.toString());
        }
    }
}
