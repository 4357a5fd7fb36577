package tech.noetzold.zta.common.model;

/**
 * Alert pressure as passed to the trust scorer.
 */
public record SiemCounts(long high, long medium) {

    public SiemCounts {
        high = Math.max(0, high);
        medium = Math.max(0, medium);
    }

    public static SiemCounts of(AlertWindowCount count) {
        return new SiemCounts(count.high(), count.medium());
    }
}
