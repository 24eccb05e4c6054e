package nl.bytesoflife.deltacard.model;

/**
 * Border around a panel. Width and corner radius are in points.
 */
public record Border(BorderStyle style, double width, Color color, double cornerRadius) {

    public Border {
        Checks.required("style", style);
        Checks.inRange("border width", width, 0.0, 10.0);
        Checks.required("color", color);
        Checks.nonNegative("corner_radius", cornerRadius);
    }

    public static Border solid(double width, Color color) {
        return new Border(BorderStyle.SOLID, width, color, 0.0);
    }
}
