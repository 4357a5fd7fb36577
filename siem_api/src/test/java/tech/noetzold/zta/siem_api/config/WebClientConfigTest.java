package tech.noetzold.zta.siem_api.config;

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

    private static String authorizationSent(SiemProperties props) {
        AtomicReference<String> header = new AtomicReference<>();
        WebClient client = new WebClientConfig().searchIndexWebClient(props).mutate()
                .exchangeFunction(req -> {
                    header.set(req.headers().getFirst(HttpHeaders.AUTHORIZATION));
                    return Mono.just(ClientResponse.create(HttpStatus.OK).build());
                })
                .build();
        client.get().uri("http://index/siem-alerts").retrieve().toBodilessEntity().block();
        return header.get();
    }

    private static String basic(String credentials) {
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Basic credentials are sent when only a user and password are set")
    void basicAuth() {
        SiemProperties props = new SiemProperties();
        props.getMirror().setUser("elastic");
        props.getMirror().setPass("changeme");

        assertEquals(basic("elastic:changeme"), authorizationSent(props));
    }

    @Test
    @DisplayName("An unset password is sent as empty, never as the text null")
    void unsetPassword() {
        SiemProperties props = new SiemProperties();
        props.getMirror().setUser("elastic");
        props.getMirror().setPass(null);

        String header = authorizationSent(props);

        assertEquals(basic("elastic:"), header);
        assertNotEquals(basic("elastic:null"), header);
    }

    @Test
    @DisplayName("An API key wins over user credentials")
    void apiKeyWins() {
        SiemProperties props = new SiemProperties();
        props.getMirror().setApiKey("k1");
        props.getMirror().setUser("elastic");

        assertEquals("ApiKey k1", authorizationSent(props));
    }

    @Test
    @DisplayName("No credentials means no authorization header")
    void anonymous() {
        assertNull(authorizationSent(new SiemProperties()));
    }
}
