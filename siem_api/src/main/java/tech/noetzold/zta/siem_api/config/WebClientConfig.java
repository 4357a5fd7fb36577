package tech.noetzold.zta.siem_api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeFilterFunctions;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient searchIndexWebClient(SiemProperties props) {
        SiemProperties.Mirror m = props.getMirror();
        WebClient.Builder builder = WebClient.builder()
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (m.getHost() != null && !m.getHost().isBlank()) {
            builder.baseUrl(m.getHost());
        }
        if (m.getApiKey() != null && !m.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + m.getApiKey());
        } else if (m.getUser() != null && !m.getUser().isBlank()) {
            builder.filter(ExchangeFilterFunctions.basicAuthentication(
                    m.getUser(), m.getPass() != null ? m.getPass() : ""));
        }
        return builder.build();
    }
}
