package nl.bytesoflife.deltacard.renderer;

import nl.bytesoflife.deltacard.model.ClipMask;
import nl.bytesoflife.deltacard.parser.PathParser;
import nl.bytesoflife.deltacard.surface.DrawingSurface;
import nl.bytesoflife.deltacard.surface.SurfacePath;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link ClipMask} into a closed surface path anchored at an image's lower-left corner
 * and applies it as the clip. The caller brackets the clip and the image draw with
 * push/pop state.
 */
public class ClippingRenderer {

    private static final Logger log = LoggerFactory.getLogger(ClippingRenderer.class);

    private final RenderOptions options;
    private final PathParser pathParser;

    public ClippingRenderer(RenderOptions options) {
        this(options, new PathParser());
    }

    public ClippingRenderer(RenderOptions options, PathParser pathParser) {
        this.options = options;
        this.pathParser = pathParser;
    }

    public void apply(DrawingSurface surface, ClipMask mask, double imageX, double imageY) {
        SurfacePath path = buildPath(mask, imageX, imageY);
        surface.clipTo(path);
        log.debug("Applied {} clip mask at ({}, {})pt", mask.type(), imageX, imageY);
    }

    /**
     * Build the clip outline; mask coordinates are inches relative to ({@code imageX}, {@code imageY}) points.
     *
     * @throws RenderException if a path mask cannot be parsed
     */
    public SurfacePath buildPath(ClipMask mask, double imageX, double imageY) {
        if (mask instanceof ClipMask.Circle c) {
            return SurfacePath.circle(imageX + pt(c.centerX()), imageY + pt(c.centerY()), pt(c.radius()));
        } else if (mask instanceof ClipMask.Rectangle r) {
            return SurfacePath.rect(imageX + pt(r.x()), imageY + pt(r.y()), pt(r.width()), pt(r.height()));
        } else if (mask instanceof ClipMask.Ellipse e) {
            return SurfacePath.ellipse(imageX + pt(e.centerX()), imageY + pt(e.centerY()),
                    pt(e.radiusX()), pt(e.radiusY()));
        } else if (mask instanceof ClipMask.Star s) {
            return StarGeometry.path(imageX + pt(s.centerX()), imageY + pt(s.centerY()),
                    pt(s.outerRadius()), pt(s.innerRadius()), s.points());
        } else if (mask instanceof ClipMask.Path p) {
            try {
                PathInterpreter interpreter = new PathInterpreter(imageX, imageY, p.scale() * options.getPointsPerInch());
                return interpreter.interpret(pathParser.parse(p.pathData()));
            } catch (PathParser.ParseException e) {
                throw new RenderException("Invalid clip path '" + p.pathData() + "': " + e.getMessage(), e);
            }
        }
        throw new RenderException("Unsupported clip mask type: " + mask.type());
    }

    /**
     * Whether the mask stays inside an image of the given size (inches). Masks reaching past the
     * image edge still work but are logged.
     */
    public boolean checkExtent(ClipMask mask, double imageWidth, double imageHeight) {
        Envelope extent = maskExtent(mask);
        if (extent == null) {
            return true;
        }
        if (extent.getMaxX() > imageWidth || extent.getMaxY() > imageHeight) {
            log.warn("{} clip mask extends beyond image ({} x {} in > {} x {} in)", mask.type(),
                    extent.getMaxX(), extent.getMaxY(), imageWidth, imageHeight);
            return false;
        }
        return true;
    }

    private static Envelope maskExtent(ClipMask mask) {
        if (mask instanceof ClipMask.Circle c) {
            return new Envelope(c.centerX() - c.radius(), c.centerX() + c.radius(),
                    c.centerY() - c.radius(), c.centerY() + c.radius());
        } else if (mask instanceof ClipMask.Rectangle r) {
            return new Envelope(r.x(), r.x() + r.width(), r.y(), r.y() + r.height());
        } else if (mask instanceof ClipMask.Ellipse e) {
            return new Envelope(e.centerX() - e.radiusX(), e.centerX() + e.radiusX(),
                    e.centerY() - e.radiusY(), e.centerY() + e.radiusY());
        } else if (mask instanceof ClipMask.Star s) {
            return new Envelope(s.centerX() - s.outerRadius(), s.centerX() + s.outerRadius(),
                    s.centerY() - s.outerRadius(), s.centerY() + s.outerRadius());
        }
        // path extents depend on interpretation
        return null;
    }

    private double pt(double inches) {
        return options.toPoints(inches);
    }
}
