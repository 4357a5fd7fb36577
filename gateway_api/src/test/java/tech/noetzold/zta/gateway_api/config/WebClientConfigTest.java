package tech.noetzold.zta.gateway_api.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WebClientConfigTest {

    private static String authorizationSent(GatewayProperties props) {
        AtomicReference<String> header = new AtomicReference<>();
        WebClient client = new WebClientConfig().telemetryWebClient(props).mutate()
                .exchangeFunction(req -> {
                    header.set(req.headers().getFirst(HttpHeaders.AUTHORIZATION));
                    return Mono.just(ClientResponse.create(HttpStatus.OK).build());
                })
                .build();
        client.get().uri("http://index/mfa-events").retrieve().toBodilessEntity().block();
        return header.get();
    }

    private static String basic(String credentials) {
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Basic credentials are sent when only a user and password are set")
    void basicAuth() {
        GatewayProperties props = new GatewayProperties();
        props.getTelemetry().setUser("elastic");
        props.getTelemetry().setPass("changeme");

        assertEquals(basic("elastic:changeme"), authorizationSent(props));
    }

    @Test
    @DisplayName("An unset password is sent as empty, never as the text null")
    void unsetPassword() {
        GatewayProperties props = new GatewayProperties();
        props.getTelemetry().setUser("elastic");
        props.getTelemetry().setPass(null);

        String header = authorizationSent(props);

        assertEquals(basic("elastic:"), header);
        assertNotEquals(basic("elastic:null"), header);
    }

    @Test
    @DisplayName("An API key wins over user credentials")
    void apiKeyWins() {
        GatewayProperties props = new GatewayProperties();
        props.getTelemetry().setApiKey("k1");
        props.getTelemetry().setUser("elastic");

        assertEquals("ApiKey k1", authorizationSent(props));
    }

    @Test
    @DisplayName("No credentials means no authorization header")
    void anonymous() {
        assertNull(authorizationSent(new GatewayProperties()));
    }
}
