package tech.noetzold.zta.gateway_api.client;

final class Interrupts {

    private Interrupts() {}

    /** Re-asserts the interrupt flag when a blocking call was cut short by an interrupt. */
    static void restoreIfInterrupted(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
