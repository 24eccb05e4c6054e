package nl.bytesoflife.deltacard.text;

/**
 * Measures the advance width of a string, in points, for a named font at a given size.
 */
@FunctionalInterface
public interface TextMeasurer {

    double measureTextWidth(String text, String fontName, double fontSize);
}
