package tech.noetzold.zta.gateway_api.model;

/**
 * The calling thread was interrupted while a decision was in flight. Nothing was persisted.
 */
public class DecisionCancelledException extends RuntimeException {

    private final String stage;

    public DecisionCancelledException(String stage) {
        super("Decision cancelled during " + stage);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
