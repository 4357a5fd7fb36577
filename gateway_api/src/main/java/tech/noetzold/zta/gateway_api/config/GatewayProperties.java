package tech.noetzold.zta.gateway_api.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "zta.gateway")
public class GatewayProperties {

    private Timeouts timeouts = new Timeouts();

    /** Alerts are emitted for non-fail-safe decisions at or above this risk. */
    private double alertThreshold = 0.25;

    /** Emitted alerts at or above this risk are high severity, below it medium. */
    private double highSeverityRisk = 0.7;

    private int alertWindowMinutes = 15;

    private Telemetry telemetry = new Telemetry();

    @Data
    public static class Timeouts {
        private Duration validation = Duration.ofMillis(2000);
        private Duration siem = Duration.ofMillis(1500);
        private Duration trust = Duration.ofMillis(2000);
    }

    @Data
    public static class Telemetry {
        private boolean enabled = false;
        private String host = "";
        private String index = "mfa-events";
        private String apiKey = "";
        private String user = "";
        private String pass = "";
        private Duration timeout = Duration.ofMillis(2000);
    }

    @PostConstruct
    public void validate() {
        unit("alert-threshold", alertThreshold);
        unit("high-severity-risk", highSeverityRisk);
        if (alertWindowMinutes <= 0) {
            throw new IllegalStateException("zta.gateway.alert-window-minutes must be > 0");
        }
        positive("timeouts.validation", timeouts.validation);
        positive("timeouts.siem", timeouts.siem);
        positive("timeouts.trust", timeouts.trust);
        if (telemetry.enabled && (telemetry.host == null || telemetry.host.isBlank())) {
            throw new IllegalStateException("zta.gateway.telemetry.host is required when telemetry is enabled");
        }
    }

    private static void unit(String name, double v) {
        if (Double.isNaN(v) || v < 0.0 || v > 1.0) {
            throw new IllegalStateException("zta.gateway." + name + " must be within [0,1], got " + v);
        }
    }

    private static void positive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalStateException("zta.gateway." + name + " must be positive");
        }
    }
}
