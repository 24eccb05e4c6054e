package nl.bytesoflife.deltacard.model;

/**
 * A point in panel-relative inches.
 */
public record Point(double x, double y) {

    public Point {
        Checks.nonNegative("x", x);
        Checks.nonNegative("y", y);
    }
}
