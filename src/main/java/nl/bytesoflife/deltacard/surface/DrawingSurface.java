package nl.bytesoflife.deltacard.surface;

import nl.bytesoflife.deltacard.model.Color;
import nl.bytesoflife.deltacard.model.ColorStop;
import nl.bytesoflife.deltacard.text.TextMeasurer;

import java.io.IOException;
import java.util.List;

/**
 * Page-oriented output device the renderers draw on. Coordinates are absolute points with
 * the origin at the page's lower-left corner.
 * <p>
 * Graphics state (colors, line width, dash, opacity, font, transforms and clip) is saved by
 * {@link #pushState()} and restored by {@link #popState()}; callers always pair the two.
 */
public interface DrawingSurface extends TextMeasurer {

    void beginPage(double width, double height);

    void setFillColor(Color color);

    void setStrokeColor(Color color);

    void setLineWidth(double width);

    /**
     * Fill and stroke alpha, 0.0 - 1.0.
     */
    void setOpacity(double opacity);

    /**
     * Dash lengths in points; no arguments resets to a solid line.
     */
    void setDash(double... pattern);

    void pushState();

    void popState();

    void rotateAbout(double cx, double cy, double degrees);

    void translate(double dx, double dy);

    void drawPath(SurfacePath path, boolean fill, boolean stroke);

    /**
     * Intersect the current clip region with {@code path}.
     */
    void clipTo(SurfacePath path);

    ImageSize naturalImageSize(String sourcePath) throws IOException;

    void drawImage(String sourcePath, double x, double y, double width, double height,
                   boolean preserveAspect) throws IOException;

    void setFont(String fontName, double size);

    /**
     * Draw one line of text with its baseline starting at (x, y) in the current font and fill color.
     */
    void drawText(String text, double x, double y);

    /**
     * Paint the current clip region with a linear gradient running from (x0, y0) to (x1, y1),
     * extended past both ends.
     *
     * @throws UnsupportedOperationException if the surface has no native gradients
     */
    default void linearGradient(double x0, double y0, double x1, double y1, List<ColorStop> stops) {
        throw new UnsupportedOperationException("Linear gradients are not supported by " + getClass().getSimpleName());
    }

    /**
     * Paint the current clip region with a radial gradient.
     *
     * @throws UnsupportedOperationException if the surface has no native gradients
     */
    default void radialGradient(double cx, double cy, double radius, List<ColorStop> stops) {
        throw new UnsupportedOperationException("Radial gradients are not supported by " + getClass().getSimpleName());
    }
}
