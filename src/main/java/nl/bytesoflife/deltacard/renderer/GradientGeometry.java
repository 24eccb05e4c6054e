package nl.bytesoflife.deltacard.renderer;

import nl.bytesoflife.deltacard.model.Color;
import nl.bytesoflife.deltacard.model.ColorStop;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * Gradient math: endpoints from an angle and bounding box, and color lookup along stops.
 */
public final class GradientGeometry {

    private GradientGeometry() {
    }

    /**
     * Start and end of a linear gradient through the center of {@code bounds}, half a diagonal
     * either side along the angle (0 = pointing right, 90 = up).
     */
    public static Coordinate[] linearEndpoints(double angle, Envelope bounds) {
        double rad = Math.toRadians(angle % 360);
        double diagonal = Math.hypot(bounds.getWidth(), bounds.getHeight());
        double dx = Math.cos(rad) * diagonal / 2;
        double dy = Math.sin(rad) * diagonal / 2;
        Coordinate center = bounds.centre();
        return new Coordinate[]{
                new Coordinate(center.x - dx, center.y - dy),
                new Coordinate(center.x + dx, center.y + dy)
        };
    }

    /**
     * Absolute center of a radial gradient given as fractions of {@code bounds}.
     */
    public static Coordinate radialCenter(double centerX, double centerY, Envelope bounds) {
        return new Coordinate(bounds.getMinX() + centerX * bounds.getWidth(),
                bounds.getMinY() + centerY * bounds.getHeight());
    }

    /**
     * Absolute radius of a radial gradient given as a fraction of the box diagonal.
     */
    public static double radialRadius(double radius, Envelope bounds) {
        return radius * Math.hypot(bounds.getWidth(), bounds.getHeight());
    }

    /**
     * Color at {@code position} (clamped to 0..1) along ascending stops.
     */
    public static Color colorAt(List<ColorStop> stops, double position) {
        if (stops.isEmpty()) {
            return Color.BLACK;
        }
        double p = Math.max(0.0, Math.min(1.0, position));
        ColorStop first = stops.get(0);
        ColorStop last = stops.get(stops.size() - 1);
        if (p <= first.position()) {
            return first.color();
        }
        if (p >= last.position()) {
            return last.color();
        }
        for (int i = 0; i < stops.size() - 1; i++) {
            ColorStop a = stops.get(i);
            ColorStop b = stops.get(i + 1);
            if (p >= a.position() && p <= b.position()) {
                double span = b.position() - a.position();
                if (span == 0) {
                    return a.color();
                }
                return a.color().interpolate(b.color(), (p - a.position()) / span);
            }
        }
        return last.color();
    }
}
