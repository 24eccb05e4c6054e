package nl.bytesoflife.deltacard.model;

/**
 * Thrown when a scene value is constructed with data that can never render correctly,
 * e.g. a malformed hex color, an out-of-range number or unordered gradient stops.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
