package tech.noetzold.zta.gateway_api.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.zta.common.model.SignalBundle;
import tech.noetzold.zta.common.model.ValidationResponse;
import tech.noetzold.zta.gateway_api.config.GatewayProperties;

import java.util.Optional;

@Component
public class ValidationServiceClient {

    private static final Logger logger = LoggerFactory.getLogger(ValidationServiceClient.class);

    private final WebClient webClient;
    private final GatewayProperties props;

    public ValidationServiceClient(@Qualifier("validationWebClient") WebClient validationWebClient,
                                   GatewayProperties props) {
        this.webClient = validationWebClient;
        this.props = props;
    }

    /** Empty on transport error, non-2xx status, timeout or missing body. */
    public Optional<ValidationResponse> validate(SignalBundle bundle) {
        try {
            return webClient.post()
                    .uri("/validation/validate")
                    .bodyValue(bundle)
                    .retrieve()
                    .bodyToMono(ValidationResponse.class)
                    .timeout(props.getTimeouts().getValidation())
                    .onErrorResume(e -> {
                        logger.warn("Validation call failed for session {}: {}", bundle.sessionId(), e.toString());
                        return Mono.empty();
                    })
                    .blockOptional()
                    .filter(r -> r.validated() != null);
        } catch (Exception e) {
            Interrupts.restoreIfInterrupted(e);
            logger.warn("Validation call aborted for session {}: {}", bundle.sessionId(), e.toString());
            return Optional.empty();
        }
    }
}
