package tech.noetzold.zta.siem_api.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "zta.siem")
public class SiemProperties {

    /** Default trailing window for alert aggregation. */
    private int windowMinutes = 15;

    private Mirror mirror = new Mirror();

    /** Risk cut-offs used when an event carries a risk but no severity. */
    private Severity severity = new Severity();

    /** Reason token to STRIDE label, consulted before the built-in table. */
    private Map<String, String> strideOverrides = new LinkedHashMap<>();

    private Poller poller = new Poller();

    @Data
    public static class Mirror {
        private boolean enabled = false;
        private String host = "";
        private String index = "siem-alerts";
        private String apiKey = "";
        private String user = "";
        private String pass = "";
        private long timeoutMs = 2000;
    }

    @Data
    public static class Severity {
        private double high = 0.75;
        private double medium = 0.25;
    }

    @Data
    public static class Poller {
        private boolean enabled = false;
        /** Index names or patterns searched on every run. */
        private List<String> indexes = new ArrayList<>(List.of("mfa-events*"));
        private Duration interval = Duration.ofSeconds(20);
        /** Elasticsearch date-math span, e.g. {@code 2m}. */
        private String lookback = "2m";
        private String sessionField = "session_id";
        private int batchSize = 200;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @PostConstruct
    public void validate() {
        if (windowMinutes <= 0) {
            throw new IllegalStateException("zta.siem.window-minutes must be > 0, got " + windowMinutes);
        }
        if (mirror.enabled && (mirror.host == null || mirror.host.isBlank())) {
            throw new IllegalStateException("zta.siem.mirror.host is required when the mirror is enabled");
        }
        if (severity.medium < 0 || severity.high > 1 || severity.medium > severity.high) {
            throw new IllegalStateException("zta.siem.severity needs 0 <= medium <= high <= 1, got medium="
                    + severity.medium + " high=" + severity.high);
        }
        if (poller.enabled) {
            if (mirror.host == null || mirror.host.isBlank()) {
                throw new IllegalStateException("zta.siem.mirror.host is required when the poller is enabled");
            }
            if (poller.indexes == null || poller.indexes.stream().allMatch(i -> i == null || i.isBlank())) {
                throw new IllegalStateException("zta.siem.poller.indexes must name at least one index");
            }
            if (poller.interval == null || poller.interval.isZero() || poller.interval.isNegative()) {
                throw new IllegalStateException("zta.siem.poller.interval must be positive");
            }
            if (poller.batchSize <= 0) {
                throw new IllegalStateException("zta.siem.poller.batch-size must be > 0, got " + poller.batchSize);
            }
        }
    }
}
