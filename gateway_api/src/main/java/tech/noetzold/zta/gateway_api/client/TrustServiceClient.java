package tech.noetzold.zta.gateway_api.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.zta.common.model.RiskAssessment;
import tech.noetzold.zta.common.model.ScoreRequest;
import tech.noetzold.zta.gateway_api.config.GatewayProperties;

import java.util.Optional;

@Component
public class TrustServiceClient {

    private static final Logger logger = LoggerFactory.getLogger(TrustServiceClient.class);

    private final WebClient webClient;
    private final GatewayProperties props;

    public TrustServiceClient(@Qualifier("trustWebClient") WebClient trustWebClient, GatewayProperties props) {
        this.webClient = trustWebClient;
        this.props = props;
    }

    public Optional<RiskAssessment> score(ScoreRequest request) {
        String sessionId = request.vector() != null ? request.vector().sessionId() : null;
        try {
            return webClient.post()
                    .uri("/trust/score")
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(RiskAssessment.class)
                    .timeout(props.getTimeouts().getTrust())
                    .onErrorResume(e -> {
                        logger.warn("Trust scoring failed for session {}: {}", sessionId, e.toString());
                        return Mono.empty();
                    })
                    .blockOptional();
        } catch (Exception e) {
            Interrupts.restoreIfInterrupted(e);
            logger.warn("Trust scoring aborted for session {}: {}", sessionId, e.toString());
            return Optional.empty();
        }
    }
}
