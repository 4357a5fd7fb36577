package tech.noetzold.zta.common.model;

public enum Enforcement {
    ALLOW,
    MFA_STEP_UP,
    DENY;

    public static Enforcement from(TrustDecision decision) {
        return switch (decision) {
            case ALLOW -> ALLOW;
            case STEP_UP -> MFA_STEP_UP;
            case DENY -> DENY;
        };
    }
}
