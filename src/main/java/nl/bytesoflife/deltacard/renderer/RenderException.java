package nl.bytesoflife.deltacard.renderer;

/**
 * A recoverable failure while drawing one element. Callers downgrade or skip the element
 * and carry on with the rest of the card.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
