package io.github.eutro.ssadce.api.events;

/**
 * A {@link DceEvent} announcing something a listener may veto.
 * <p>
 * Once cancelled, an event is not passed to any further listeners.
 */
public abstract class CancellableEvent implements DceEvent {
    private String cancelReason;

    public boolean isCancelled() {
        return cancelReason != null;
    }

    public void cancel() {
        cancel("cancelled");
    }

    /**
     * Cancel the event, with a reason that ends up in the report.
     *
     * @param reason The reason.
     */
    public void cancel(String reason) {
        if (cancelReason == null) cancelReason = reason;
    }

    /**
     * @return Why the event was first cancelled, or null if it was not.
     */
    public String getCancelReason() {
        return cancelReason;
    }
}
