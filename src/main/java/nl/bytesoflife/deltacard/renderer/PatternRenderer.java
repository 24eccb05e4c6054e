package nl.bytesoflife.deltacard.renderer;

import nl.bytesoflife.deltacard.model.Color;
import nl.bytesoflife.deltacard.model.FillStyle;
import nl.bytesoflife.deltacard.surface.DrawingSurface;
import nl.bytesoflife.deltacard.surface.SurfacePath;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills a rectangle with a repeating pattern. One square tile is synthesized per fill and
 * stamped across the rectangle inside a clip, with an optional rotation of the whole grid
 * about the rectangle center.
 */
public class PatternRenderer {

    private static final Logger log = LoggerFactory.getLogger(PatternRenderer.class);

    private final RenderOptions options;

    public PatternRenderer(RenderOptions options) {
        this.options = options;
    }

    /**
     * One mark inside a tile, in tile-local points. A null fill or stroke means not painted.
     */
    public record TileMark(SurfacePath path, Color fill, Color stroke, double lineWidth) {
    }

    public double tileSize(FillStyle.Pattern pattern) {
        return Math.max(options.toPoints(pattern.spacing()) * pattern.scale(), options.getMinTileSize());
    }

    /**
     * @return true if the pattern was drawn, false if it fell back to a solid fill of the first color
     */
    public boolean render(DrawingSurface surface, FillStyle.Pattern pattern, Envelope bounds) {
        try {
            double tile = tileSize(pattern);
            List<TileMark> marks = synthesizeTile(pattern, tile);
            int columns = (int) Math.ceil(bounds.getWidth() / tile) + 1;
            int rows = (int) Math.ceil(bounds.getHeight() / tile) + 1;

            surface.pushState();
            try {
                surface.clipTo(SurfacePath.rect(bounds.getMinX(), bounds.getMinY(), bounds.getWidth(), bounds.getHeight()));
                if (pattern.rotation() != 0) {
                    surface.rotateAbout(bounds.centre().x, bounds.centre().y, pattern.rotation());
                }
                for (int row = 0; row < rows; row++) {
                    for (int col = 0; col < columns; col++) {
                        stamp(surface, marks, bounds.getMinX() + col * tile, bounds.getMinY() + row * tile);
                    }
                }
            } finally {
                surface.popState();
            }
            log.debug("Pattern {}: tile={}pt, {}x{} stamps", pattern.kind().getKey(), tile, columns, rows);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to render {} pattern ({}), falling back to solid {}",
                    pattern.kind().getKey(), e.getMessage(), pattern.fallbackColor());
            log.debug("Pattern failure", e);
            GradientRenderer.fillSolid(surface, pattern.fallbackColor(), bounds);
            return false;
        }
    }

    /**
     * Marks making up one tile of {@code size} points square, origin at the tile's lower-left corner.
     */
    public List<TileMark> synthesizeTile(FillStyle.Pattern pattern, double size) {
        List<Color> colors = pattern.colors();
        List<TileMark> marks = new ArrayList<>();
        switch (pattern.kind()) {
            case STRIPES -> {
                double band = size / colors.size();
                for (int i = 0; i < colors.size(); i++) {
                    marks.add(new TileMark(SurfacePath.rect(i * band, 0, band, size), colors.get(i), null, 0));
                }
            }
            case DOTS -> {
                if (colors.size() > 1) {
                    marks.add(new TileMark(SurfacePath.rect(0, 0, size, size), colors.get(1), null, 0));
                }
                marks.add(new TileMark(SurfacePath.circle(size / 2, size / 2, size * 0.3), colors.get(0), null, 0));
            }
            case GRID -> {
                double width = Math.max(1.0, size * 0.05);
                // bottom and left edges; neighbouring tiles complete the grid
                marks.add(new TileMark(SurfacePath.line(0, 0, size, 0), null, colors.get(0), width));
                marks.add(new TileMark(SurfacePath.line(0, 0, 0, size), null, colors.get(0), width));
            }
            case CHECKERBOARD -> {
                double half = size / 2;
                Color first = colors.get(0);
                Color second = colors.size() > 1 ? colors.get(1) : Color.WHITE;
                marks.add(new TileMark(SurfacePath.rect(0, half, half, half), first, null, 0));
                marks.add(new TileMark(SurfacePath.rect(half, 0, half, half), first, null, 0));
                marks.add(new TileMark(SurfacePath.rect(half, half, half, half), second, null, 0));
                marks.add(new TileMark(SurfacePath.rect(0, 0, half, half), second, null, 0));
            }
        }
        return marks;
    }

    private void stamp(DrawingSurface surface, List<TileMark> marks, double x, double y) {
        surface.pushState();
        try {
            surface.translate(x, y);
            for (TileMark mark : marks) {
                if (mark.fill() != null) {
                    surface.setFillColor(mark.fill());
                }
                if (mark.stroke() != null) {
                    surface.setStrokeColor(mark.stroke());
                    surface.setLineWidth(mark.lineWidth());
                }
                surface.drawPath(mark.path(), mark.fill() != null, mark.stroke() != null);
            }
        } finally {
            surface.popState();
        }
    }
}
