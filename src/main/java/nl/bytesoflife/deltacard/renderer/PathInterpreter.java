package nl.bytesoflife.deltacard.renderer;

import nl.bytesoflife.deltacard.parser.PathCommand;
import nl.bytesoflife.deltacard.surface.SurfacePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns parsed path commands into a {@link SurfacePath}. Path coordinates are inches; each is
 * mapped to {@code origin + value * unitScale} on the surface.
 * <p>
 * Quadratic curves are elevated to cubics. Elliptical arcs are approximated by a straight line
 * to the arc's end point.
 */
public class PathInterpreter {

    private static final Logger log = LoggerFactory.getLogger(PathInterpreter.class);

    private final double originX;
    private final double originY;
    private final double unitScale;

    // Path-space state, in inches
    private double currentX;
    private double currentY;
    private double subpathStartX;
    private double subpathStartY;
    private double[] lastCubicControl;
    private double[] lastQuadControl;
    private int approximatedArcs;

    public PathInterpreter(double originX, double originY, double unitScale) {
        this.originX = originX;
        this.originY = originY;
        this.unitScale = unitScale;
    }

    public SurfacePath interpret(List<PathCommand> commands) {
        SurfacePath path = new SurfacePath();
        currentX = 0;
        currentY = 0;
        subpathStartX = 0;
        subpathStartY = 0;
        approximatedArcs = 0;
        lastCubicControl = null;
        lastQuadControl = null;

        for (PathCommand command : commands) {
            for (int g = 0; g < command.groupCount(); g++) {
                apply(path, command, g);
            }
        }
        return path;
    }

    /**
     * Number of arc segments drawn as straight lines by the last {@link #interpret} call.
     */
    public int getApproximatedArcs() {
        return approximatedArcs;
    }

    private void apply(SurfacePath path, PathCommand command, int group) {
        boolean rel = command.relative();
        double[] p = command.group(group);
        double baseX = rel ? currentX : 0;
        double baseY = rel ? currentY : 0;
        double[] cubic = null;
        double[] quad = null;

        switch (command.type()) {
            case MOVE_TO -> {
                currentX = baseX + p[0];
                currentY = baseY + p[1];
                if (group == 0) {
                    subpathStartX = currentX;
                    subpathStartY = currentY;
                    path.moveTo(x(currentX), y(currentY));
                } else {
                    // extra coordinate pairs after a move are implicit line-tos
                    path.lineTo(x(currentX), y(currentY));
                }
            }
            case LINE_TO -> {
                currentX = baseX + p[0];
                currentY = baseY + p[1];
                path.lineTo(x(currentX), y(currentY));
            }
            case HORIZONTAL_LINE_TO -> {
                currentX = baseX + p[0];
                path.lineTo(x(currentX), y(currentY));
            }
            case VERTICAL_LINE_TO -> {
                currentY = baseY + p[0];
                path.lineTo(x(currentX), y(currentY));
            }
            case CURVE_TO -> {
                double c1x = baseX + p[0];
                double c1y = baseY + p[1];
                double c2x = baseX + p[2];
                double c2y = baseY + p[3];
                cubicTo(path, c1x, c1y, c2x, c2y, baseX + p[4], baseY + p[5]);
                cubic = new double[]{c2x, c2y};
            }
            case SMOOTH_CURVE_TO -> {
                double[] c1 = reflect(lastCubicControl);
                double c2x = baseX + p[0];
                double c2y = baseY + p[1];
                cubicTo(path, c1[0], c1[1], c2x, c2y, baseX + p[2], baseY + p[3]);
                cubic = new double[]{c2x, c2y};
            }
            case QUADRATIC_CURVE_TO -> {
                double qx = baseX + p[0];
                double qy = baseY + p[1];
                quadTo(path, qx, qy, baseX + p[2], baseY + p[3]);
                quad = new double[]{qx, qy};
            }
            case SMOOTH_QUADRATIC_CURVE_TO -> {
                double[] q = reflect(lastQuadControl);
                quadTo(path, q[0], q[1], baseX + p[0], baseY + p[1]);
                quad = q;
            }
            case ARC -> {
                currentX = baseX + p[5];
                currentY = baseY + p[6];
                approximatedArcs++;
                log.debug("Arc (rx={}, ry={}) approximated as line to ({}, {})", p[0], p[1], currentX, currentY);
                path.lineTo(x(currentX), y(currentY));
            }
            case CLOSE_PATH -> {
                path.close();
                currentX = subpathStartX;
                currentY = subpathStartY;
            }
        }
        lastCubicControl = cubic;
        lastQuadControl = quad;
    }

    private void cubicTo(SurfacePath path, double c1x, double c1y, double c2x, double c2y, double ex, double ey) {
        path.curveTo(x(c1x), y(c1y), x(c2x), y(c2y), x(ex), y(ey));
        currentX = ex;
        currentY = ey;
    }

    // Degree elevation: a quadratic with control q equals the cubic with controls 2/3 of the
    // way from each end point towards q.
    private void quadTo(SurfacePath path, double qx, double qy, double ex, double ey) {
        double c1x = currentX + 2.0 / 3.0 * (qx - currentX);
        double c1y = currentY + 2.0 / 3.0 * (qy - currentY);
        double c2x = ex + 2.0 / 3.0 * (qx - ex);
        double c2y = ey + 2.0 / 3.0 * (qy - ey);
        cubicTo(path, c1x, c1y, c2x, c2y, ex, ey);
    }

    private double[] reflect(double[] control) {
        if (control == null) {
            return new double[]{currentX, currentY};
        }
        return new double[]{2 * currentX - control[0], 2 * currentY - control[1]};
    }

    private double x(double value) {
        return originX + value * unitScale;
    }

    private double y(double value) {
        return originY + value * unitScale;
    }
}
