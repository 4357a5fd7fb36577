package tech.noetzold.zta.common.model;

/**
 * Why a signal bundle looked suspicious. Each reason belongs to exactly one
 * {@link StrideCategory} and carries the default risk increment the trust scorer
 * adds for it. Reasons that describe the content of a single signal name that
 * signal so the scorer can scale the increment by its validated weight.
 */
public enum AnomalyReason {

    LOCATION_MISMATCH(StrideCategory.SPOOFING, 0.20, null),
    SIGNAL_STALE(StrideCategory.SPOOFING, 0.05, null),
    SIGNAL_MALFORMED(StrideCategory.TAMPERING, 0.06, null),
    TLS_ANOMALY(StrideCategory.TAMPERING, 0.20, SignalType.TLS_FINGERPRINT),
    POSTURE_OUTDATED(StrideCategory.TAMPERING, 0.08, SignalType.DEVICE_POSTURE),
    DEVICE_UNHEALTHY(StrideCategory.TAMPERING, 0.12, SignalType.DEVICE_POSTURE),
    SIGNAL_MISSING(StrideCategory.REPUDIATION, 0.03, null),
    INSUFFICIENT_SIGNAL(StrideCategory.REPUDIATION, 0.15, null),
    RECONNAISSANCE(StrideCategory.INFORMATION_DISCLOSURE, 0.20, null),
    DOWNLOAD_EXFIL(StrideCategory.INFORMATION_DISCLOSURE, 0.40, null),
    BRUTE_FORCE(StrideCategory.DENIAL_OF_SERVICE, 0.40, null),
    DENIAL_OF_SERVICE(StrideCategory.DENIAL_OF_SERVICE, 0.55, null),
    POLICY_ELEVATION(StrideCategory.ELEVATION_OF_PRIVILEGE, 0.40, null);

    private final StrideCategory stride;
    private final double defaultIncrement;
    private final SignalType linkedSignal;

    AnomalyReason(StrideCategory stride, double defaultIncrement, SignalType linkedSignal) {
        this.stride = stride;
        this.defaultIncrement = defaultIncrement;
        this.linkedSignal = linkedSignal;
    }

    public StrideCategory stride() {
        return stride;
    }

    public double defaultIncrement() {
        return defaultIncrement;
    }

    /** Signal whose weight scales this reason, or {@code null}. */
    public SignalType linkedSignal() {
        return linkedSignal;
    }
}
