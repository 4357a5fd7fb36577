package tech.noetzold.zta.gateway_api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeFilterFunctions;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient validationWebClient(@Value("${zta.gateway.validation-url:http://localhost:8001}") String url) {
        return jsonClient(url).build();
    }

    @Bean
    public WebClient siemWebClient(@Value("${zta.gateway.siem-url:http://localhost:8002}") String url) {
        return jsonClient(url).build();
    }

    @Bean
    public WebClient trustWebClient(@Value("${zta.gateway.trust-url:http://localhost:8003}") String url) {
        return jsonClient(url).build();
    }

    @Bean
    public WebClient telemetryWebClient(GatewayProperties props) {
        GatewayProperties.Telemetry t = props.getTelemetry();
        WebClient.Builder builder = WebClient.builder()
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (t.getHost() != null && !t.getHost().isBlank()) {
            builder.baseUrl(t.getHost());
        }
        if (t.getApiKey() != null && !t.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + t.getApiKey());
        } else if (t.getUser() != null && !t.getUser().isBlank()) {
            builder.filter(ExchangeFilterFunctions.basicAuthentication(
                    t.getUser(), t.getPass() != null ? t.getPass() : ""));
        }
        return builder.build();
    }

    private static WebClient.Builder jsonClient(String baseUrl) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
    }
}
