package nl.bytesoflife.deltacard.model;

/**
 * A color at a position (0.0 = start, 1.0 = end) along a gradient.
 */
public record ColorStop(double position, Color color) {

    public ColorStop {
        if (!(position >= 0.0 && position <= 1.0)) {
            throw new ValidationException("Color stop position " + position + " out of range (0.0-1.0)");
        }
        if (color == null) {
            throw new ValidationException("Color stop requires a color");
        }
    }

    public static ColorStop of(double position, String hex) {
        return new ColorStop(position, Color.fromHex(hex));
    }
}
