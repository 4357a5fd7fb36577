package tech.noetzold.zta.validation_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.zta.common.model.AnomalyReason;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static tech.noetzold.zta.common.model.AnomalyReason.BRUTE_FORCE;
import static tech.noetzold.zta.common.model.AnomalyReason.DENIAL_OF_SERVICE;
import static tech.noetzold.zta.common.model.AnomalyReason.DOWNLOAD_EXFIL;
import static tech.noetzold.zta.common.model.AnomalyReason.POLICY_ELEVATION;
import static tech.noetzold.zta.common.model.AnomalyReason.RECONNAISSANCE;
import static tech.noetzold.zta.common.model.AnomalyReason.TLS_ANOMALY;

/**
 * Maps CICIDS2017-style traffic labels attached to a bundle onto anomaly reasons.
 */
@Component
public class ThreatLabelClassifier {

    private static final Map<String, List<AnomalyReason>> TABLE = Map.ofEntries(
            Map.entry("DDOS", List.of(DENIAL_OF_SERVICE)),
            Map.entry("DOSHULK", List.of(DENIAL_OF_SERVICE)),
            Map.entry("DOSGOLDENEYE", List.of(DENIAL_OF_SERVICE)),
            Map.entry("DOSSLOWLORIS", List.of(DENIAL_OF_SERVICE)),
            Map.entry("DOSSLOWHTTPTEST", List.of(DENIAL_OF_SERVICE)),
            Map.entry("DOS", List.of(DENIAL_OF_SERVICE)),
            Map.entry("FTPPATATOR", List.of(BRUTE_FORCE)),
            Map.entry("SSHPATATOR", List.of(BRUTE_FORCE)),
            Map.entry("WEBATTACKBRUTEFORCE", List.of(BRUTE_FORCE)),
            Map.entry("WEBATTACKXSS", List.of(POLICY_ELEVATION)),
            Map.entry("WEBATTACKSQLINJECTION", List.of(POLICY_ELEVATION)),
            Map.entry("INFILTRATION", List.of(DOWNLOAD_EXFIL)),
            Map.entry("BOT", List.of(DOWNLOAD_EXFIL)),
            Map.entry("HEARTBLEED", List.of(TLS_ANOMALY, DOWNLOAD_EXFIL)),
            Map.entry("PORTSCAN", List.of(RECONNAISSANCE)));

    public List<AnomalyReason> classify(String label) {
        if (label == null) return List.of();
        return TABLE.getOrDefault(normalize(label), List.of());
    }

    static String normalize(String label) {
        return label.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
    }
}
