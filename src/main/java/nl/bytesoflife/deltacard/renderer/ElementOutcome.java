package nl.bytesoflife.deltacard.renderer;

/**
 * Result of drawing one element. DEGRADED means something was drawn but not as described
 * (e.g. a gradient replaced by a solid fill); SKIPPED means nothing was drawn.
 */
public record ElementOutcome(String elementId, String elementType, Status status, String message) {

    public enum Status {
        RENDERED, DEGRADED, SKIPPED
    }

    public static ElementOutcome rendered(String elementId, String elementType) {
        return new ElementOutcome(elementId, elementType, Status.RENDERED, null);
    }

    public static ElementOutcome degraded(String elementId, String elementType, String message) {
        return new ElementOutcome(elementId, elementType, Status.DEGRADED, message);
    }

    public static ElementOutcome skipped(String elementId, String elementType, String message) {
        return new ElementOutcome(elementId, elementType, Status.SKIPPED, message);
    }

    public boolean isRendered() {
        return status == Status.RENDERED;
    }

    /**
     * Combine with another outcome for the same element, keeping the worse status.
     */
    public ElementOutcome worst(ElementOutcome other) {
        return other.status.ordinal() > status.ordinal() ? other : this;
    }

    @Override
    public String toString() {
        String base = "[" + status + "] " + elementType + " " + elementId;
        return message != null ? base + ": " + message : base;
    }
}
