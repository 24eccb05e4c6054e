package nl.bytesoflife.deltacard.renderer;

import nl.bytesoflife.deltacard.model.Color;
import nl.bytesoflife.deltacard.model.FillStyle;
import nl.bytesoflife.deltacard.surface.DrawingSurface;
import nl.bytesoflife.deltacard.surface.SurfacePath;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paints linear and radial gradients over a bounding box using the surface's native
 * gradient primitives. The caller sets up the clip to the shape outline.
 */
public class GradientRenderer {

    private static final Logger log = LoggerFactory.getLogger(GradientRenderer.class);

    /**
     * Paint {@code fill} across {@code bounds} (points).
     *
     * @return true if the gradient was painted, false if it fell back to a solid fill of the
     * first stop's color
     */
    public boolean render(DrawingSurface surface, FillStyle fill, Envelope bounds) {
        try {
            if (fill instanceof FillStyle.LinearGradient linear) {
                Coordinate[] ends = GradientGeometry.linearEndpoints(linear.angle(), bounds);
                log.debug("Linear gradient: angle={}, stops={}, from {} to {}",
                        linear.angle(), linear.stops().size(), ends[0], ends[1]);
                surface.linearGradient(ends[0].x, ends[0].y, ends[1].x, ends[1].y, linear.stops());
            } else if (fill instanceof FillStyle.RadialGradient radial) {
                Coordinate center = GradientGeometry.radialCenter(radial.centerX(), radial.centerY(), bounds);
                double radius = GradientGeometry.radialRadius(radial.radius(), bounds);
                log.debug("Radial gradient: center={}, radius={}, stops={}", center, radius, radial.stops().size());
                surface.radialGradient(center.x, center.y, radius, radial.stops());
            } else {
                throw new RenderException("Not a gradient fill: " + fill.type());
            }
            return true;
        } catch (RuntimeException e) {
            Color fallback = fill.fallbackColor();
            log.warn("Failed to render {} ({}), falling back to solid {}", fill.type(), e.getMessage(), fallback);
            log.debug("Gradient failure", e);
            fillSolid(surface, fallback, bounds);
            return false;
        }
    }

    static void fillSolid(DrawingSurface surface, Color color, Envelope bounds) {
        if (bounds.isNull()) {
            return;
        }
        surface.setFillColor(color);
        surface.drawPath(SurfacePath.rect(bounds.getMinX(), bounds.getMinY(), bounds.getWidth(), bounds.getHeight()),
                true, false);
    }
}
