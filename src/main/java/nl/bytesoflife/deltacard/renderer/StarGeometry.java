package nl.bytesoflife.deltacard.renderer;

import nl.bytesoflife.deltacard.surface.SurfacePath;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * Star polygon vertices, alternating outer and inner radius, starting straight down from the
 * center (-90 degrees) and stepping counter-clockwise.
 */
public final class StarGeometry {

    private StarGeometry() {
    }

    public static List<Coordinate> vertices(double cx, double cy, double outerRadius, double innerRadius,
                                            int points) {
        List<Coordinate> vertices = new ArrayList<>(points * 2);
        double step = 360.0 / (points * 2);
        for (int i = 0; i < points * 2; i++) {
            double angle = Math.toRadians(i * step - 90);
            double radius = i % 2 == 0 ? outerRadius : innerRadius;
            vertices.add(new Coordinate(cx + radius * Math.cos(angle), cy + radius * Math.sin(angle)));
        }
        return vertices;
    }

    public static SurfacePath path(double cx, double cy, double outerRadius, double innerRadius, int points) {
        List<double[]> outline = new ArrayList<>();
        for (Coordinate c : vertices(cx, cy, outerRadius, innerRadius, points)) {
            outline.add(new double[]{c.x, c.y});
        }
        return SurfacePath.polygon(outline);
    }
}
