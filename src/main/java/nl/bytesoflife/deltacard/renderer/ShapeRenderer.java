package nl.bytesoflife.deltacard.renderer;

import nl.bytesoflife.deltacard.model.Color;
import nl.bytesoflife.deltacard.model.FillStyle;
import nl.bytesoflife.deltacard.model.Point;
import nl.bytesoflife.deltacard.model.Shape;
import nl.bytesoflife.deltacard.model.ShapeStyle;
import nl.bytesoflife.deltacard.parser.PathCommand;
import nl.bytesoflife.deltacard.parser.PathParser;
import nl.bytesoflife.deltacard.surface.DrawingSurface;
import nl.bytesoflife.deltacard.surface.SurfacePath;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Draws primitive shapes. Shape coordinates are inches relative to the panel; the panel
 * offset (inches from the page origin) is added before conversion to points.
 * <p>
 * Every shape is drawn inside its own push/pop pair so opacity, rotation and paint never
 * carry over to the next shape.
 */
public class ShapeRenderer {

    private static final Logger log = LoggerFactory.getLogger(ShapeRenderer.class);

    private final RenderOptions options;
    private final PathParser pathParser;
    private final GradientRenderer gradientRenderer;
    private final PatternRenderer patternRenderer;

    public ShapeRenderer(RenderOptions options) {
        this(options, new PathParser(), new GradientRenderer(), new PatternRenderer(options));
    }

    public ShapeRenderer(RenderOptions options, PathParser pathParser,
                         GradientRenderer gradientRenderer, PatternRenderer patternRenderer) {
        this.options = options;
        this.pathParser = pathParser;
        this.gradientRenderer = gradientRenderer;
        this.patternRenderer = patternRenderer;
    }

    /**
     * Outline, rotation pivot and fill bounds of a shape, all in points.
     */
    record Geometry(SurfacePath outline, Coordinate pivot, Envelope bounds, String note) {
    }

    public ElementOutcome render(DrawingSurface surface, Shape.Primitive shape, double panelX, double panelY) {
        Geometry geometry;
        try {
            geometry = geometry(shape, panelX, panelY);
        } catch (RenderException e) {
            log.warn("Skipping {} {}: {}", shape.type(), shape.id(), e.getMessage());
            return ElementOutcome.skipped(shape.id(), shape.type(), e.getMessage());
        }
        if (geometry.outline().isEmpty()) {
            log.warn("Skipping {} {}: nothing to draw", shape.type(), shape.id());
            return ElementOutcome.skipped(shape.id(), shape.type(), "empty outline");
        }

        ShapeStyle style = shape.style();
        String degradation = geometry.note();
        surface.pushState();
        try {
            if (style.opacity() < 1.0) {
                surface.setOpacity(style.opacity());
            }
            if (style.rotation() != 0.0) {
                surface.rotateAbout(geometry.pivot().x, geometry.pivot().y, style.rotation());
            }

            if (shape instanceof Shape.Line) {
                surface.setStrokeColor(style.strokeColor() != null ? style.strokeColor() : Color.BLACK);
                surface.setLineWidth(style.strokeWidth() > 0 ? style.strokeWidth() : 1.0);
                surface.drawPath(geometry.outline(), false, true);
            } else {
                boolean fill = false;
                FillStyle fillStyle = style.effectiveFill();
                if (fillStyle instanceof FillStyle.Solid solid) {
                    surface.setFillColor(solid.color());
                    fill = true;
                } else if (fillStyle != null) {
                    if (!paintFill(surface, fillStyle, geometry)) {
                        degradation = fillStyle.type() + " replaced by solid " + fillStyle.fallbackColor();
                    }
                }

                boolean stroke = style.hasStroke();
                if (stroke) {
                    surface.setStrokeColor(style.strokeColor());
                    surface.setLineWidth(style.strokeWidth());
                }
                if (fill || stroke) {
                    surface.drawPath(geometry.outline(), fill, stroke);
                }
            }
        } catch (RuntimeException e) {
            log.error("Failed to render {} {}: {}", shape.type(), shape.id(), e.getMessage());
            log.debug("Shape failure", e);
            return ElementOutcome.skipped(shape.id(), shape.type(), e.getMessage());
        } finally {
            surface.popState();
        }

        log.debug("Rendered {} {} bounds={}", shape.type(), shape.id(), geometry.bounds());
        return degradation == null
                ? ElementOutcome.rendered(shape.id(), shape.type())
                : ElementOutcome.degraded(shape.id(), shape.type(), degradation);
    }

    // Gradient and pattern fills are painted inside the shape outline instead of a solid fill.
    private boolean paintFill(DrawingSurface surface, FillStyle fillStyle, Geometry geometry) {
        surface.pushState();
        try {
            surface.clipTo(geometry.outline());
            if (fillStyle instanceof FillStyle.Pattern pattern) {
                return patternRenderer.render(surface, pattern, geometry.bounds());
            }
            return gradientRenderer.render(surface, fillStyle, geometry.bounds());
        } finally {
            surface.popState();
        }
    }

    Geometry geometry(Shape.Primitive shape, double panelX, double panelY) {
        if (shape instanceof Shape.Rectangle r) {
            double x = pt(panelX + r.x());
            double y = pt(panelY + r.y());
            double w = pt(r.width());
            double h = pt(r.height());
            Envelope bounds = new Envelope(x, x + w, y, y + h);
            return new Geometry(SurfacePath.rect(x, y, w, h), bounds.centre(), bounds, null);
        } else if (shape instanceof Shape.Circle c) {
            double cx = pt(panelX + c.centerX());
            double cy = pt(panelY + c.centerY());
            double r = pt(c.radius());
            return new Geometry(SurfacePath.circle(cx, cy, r), new Coordinate(cx, cy),
                    new Envelope(cx - r, cx + r, cy - r, cy + r), null);
        } else if (shape instanceof Shape.Triangle t) {
            List<double[]> vertices = new ArrayList<>();
            double sumX = 0;
            double sumY = 0;
            for (Point p : List.of(t.p1(), t.p2(), t.p3())) {
                double x = pt(panelX + p.x());
                double y = pt(panelY + p.y());
                vertices.add(new double[]{x, y});
                sumX += x;
                sumY += y;
            }
            SurfacePath outline = SurfacePath.polygon(vertices);
            return new Geometry(outline, new Coordinate(sumX / 3, sumY / 3), outline.getBounds(), null);
        } else if (shape instanceof Shape.Star s) {
            double cx = pt(panelX + s.centerX());
            double cy = pt(panelY + s.centerY());
            double outer = pt(s.outerRadius());
            return new Geometry(StarGeometry.path(cx, cy, outer, pt(s.innerRadius()), s.points()),
                    new Coordinate(cx, cy), new Envelope(cx - outer, cx + outer, cy - outer, cy + outer), null);
        } else if (shape instanceof Shape.Line l) {
            double x1 = pt(panelX + l.start().x());
            double y1 = pt(panelY + l.start().y());
            double x2 = pt(panelX + l.end().x());
            double y2 = pt(panelY + l.end().y());
            return new Geometry(SurfacePath.line(x1, y1, x2, y2), new Coordinate((x1 + x2) / 2, (y1 + y2) / 2),
                    new Envelope(x1, x2, y1, y2), null);
        } else if (shape instanceof Shape.Path p) {
            return pathGeometry(p, panelX, panelY);
        }
        throw new RenderException("Unsupported shape type: " + shape.type());
    }

    private Geometry pathGeometry(Shape.Path shape, double panelX, double panelY) {
        List<PathCommand> commands;
        try {
            commands = pathParser.parse(shape.pathData());
        } catch (PathParser.ParseException e) {
            throw new RenderException("Invalid path data at position " + e.getPosition() + ": " + e.getMessage(), e);
        }
        if (commands.isEmpty()) {
            throw new RenderException("Path has no valid commands: " + shape.pathData());
        }
        PathInterpreter interpreter = new PathInterpreter(pt(panelX), pt(panelY),
                shape.scale() * options.getPointsPerInch());
        SurfacePath outline = interpreter.interpret(commands);
        Envelope bounds = outline.getBounds();
        String note = null;
        if (interpreter.getApproximatedArcs() > 0) {
            note = interpreter.getApproximatedArcs() + " arc segment(s) drawn as straight lines";
        }
        Coordinate pivot = bounds.isNull() ? new Coordinate(pt(panelX), pt(panelY)) : bounds.centre();
        return new Geometry(outline, pivot, bounds, note);
    }

    private double pt(double inches) {
        return options.toPoints(inches);
    }
}
