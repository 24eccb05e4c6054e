package nl.bytesoflife.deltacard.surface;

import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Path in absolute surface coordinates (points), built from move, line, cubic curve and
 * close segments.
 */
public class SurfacePath {

    /** Control-point distance for approximating a quarter circle with one cubic curve. */
    public static final double KAPPA = 0.5522847498;

    public sealed interface Segment permits MoveTo, LineTo, CurveTo, Close {
    }

    public record MoveTo(double x, double y) implements Segment {
    }

    public record LineTo(double x, double y) implements Segment {
    }

    public record CurveTo(double x1, double y1, double x2, double y2, double x, double y) implements Segment {
    }

    public record Close() implements Segment {
    }

    private final List<Segment> segments = new ArrayList<>();

    public SurfacePath moveTo(double x, double y) {
        segments.add(new MoveTo(x, y));
        return this;
    }

    public SurfacePath lineTo(double x, double y) {
        segments.add(new LineTo(x, y));
        return this;
    }

    public SurfacePath curveTo(double x1, double y1, double x2, double y2, double x, double y) {
        segments.add(new CurveTo(x1, y1, x2, y2, x, y));
        return this;
    }

    public SurfacePath close() {
        segments.add(new Close());
        return this;
    }

    public List<Segment> getSegments() {
        return Collections.unmodifiableList(segments);
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    /**
     * Bounding box of all segment points, control points included. Empty envelope for an
     * empty path.
     */
    public Envelope getBounds() {
        Envelope env = new Envelope();
        for (Segment segment : segments) {
            if (segment instanceof MoveTo m) {
                env.expandToInclude(m.x(), m.y());
            } else if (segment instanceof LineTo l) {
                env.expandToInclude(l.x(), l.y());
            } else if (segment instanceof CurveTo c) {
                env.expandToInclude(c.x1(), c.y1());
                env.expandToInclude(c.x2(), c.y2());
                env.expandToInclude(c.x(), c.y());
            }
        }
        return env;
    }

    public static SurfacePath rect(double x, double y, double width, double height) {
        return new SurfacePath()
                .moveTo(x, y)
                .lineTo(x + width, y)
                .lineTo(x + width, y + height)
                .lineTo(x, y + height)
                .close();
    }

    public static SurfacePath circle(double cx, double cy, double r) {
        return ellipse(cx, cy, r, r);
    }

    /**
     * Ellipse as four cubic quarter arcs, counter-clockwise from the rightmost point.
     */
    public static SurfacePath ellipse(double cx, double cy, double rx, double ry) {
        double kx = rx * KAPPA;
        double ky = ry * KAPPA;
        return new SurfacePath()
                .moveTo(cx + rx, cy)
                .curveTo(cx + rx, cy + ky, cx + kx, cy + ry, cx, cy + ry)
                .curveTo(cx - kx, cy + ry, cx - rx, cy + ky, cx - rx, cy)
                .curveTo(cx - rx, cy - ky, cx - kx, cy - ry, cx, cy - ry)
                .curveTo(cx + kx, cy - ry, cx + rx, cy - ky, cx + rx, cy)
                .close();
    }

    /**
     * Rectangle with rounded corners. The radius is capped at half the shorter side.
     */
    public static SurfacePath roundRect(double x, double y, double width, double height, double radius) {
        double r = Math.min(radius, Math.min(width, height) / 2);
        if (r <= 0) {
            return rect(x, y, width, height);
        }
        double k = r * KAPPA;
        double right = x + width;
        double top = y + height;
        return new SurfacePath()
                .moveTo(x + r, y)
                .lineTo(right - r, y)
                .curveTo(right - r + k, y, right, y + r - k, right, y + r)
                .lineTo(right, top - r)
                .curveTo(right, top - r + k, right - r + k, top, right - r, top)
                .lineTo(x + r, top)
                .curveTo(x + r - k, top, x, top - r + k, x, top - r)
                .lineTo(x, y + r)
                .curveTo(x, y + r - k, x + r - k, y, x + r, y)
                .close();
    }

    public static SurfacePath polygon(List<double[]> points) {
        SurfacePath path = new SurfacePath();
        for (int i = 0; i < points.size(); i++) {
            double[] p = points.get(i);
            if (i == 0) {
                path.moveTo(p[0], p[1]);
            } else {
                path.lineTo(p[0], p[1]);
            }
        }
        return path.close();
    }

    public static SurfacePath line(double x1, double y1, double x2, double y2) {
        return new SurfacePath().moveTo(x1, y1).lineTo(x2, y2);
    }

    @Override
    public String toString() {
        return "SurfacePath" + segments;
    }
}
