package nl.bytesoflife.deltacard.renderer;

import nl.bytesoflife.deltacard.model.*;
import nl.bytesoflife.deltacard.surface.RecordingSurface;
import nl.bytesoflife.deltacard.surface.SurfacePath.Close;
import nl.bytesoflife.deltacard.surface.SurfacePath.LineTo;
import nl.bytesoflife.deltacard.surface.SurfacePath.MoveTo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShapeRendererTest {

    private final ShapeRenderer renderer = new ShapeRenderer(RenderOptions.defaults());
    private final RecordingSurface surface = new RecordingSurface();

    private static final List<ColorStop> STOPS = List.of(ColorStop.of(0, "#ff0000"), ColorStop.of(1, "#0000ff"));

    @Test
    void rectangleIsFilledAtPointCoordinates() {
        Shape.Rectangle rect = new Shape.Rectangle(ShapeStyle.builder().fillColor(Color.RED).build(), 0.5, 0.5, 4, 3);

        ElementOutcome outcome = renderer.render(surface, rect, 0, 0);

        assertEquals(ElementOutcome.Status.RENDERED, outcome.status());
        assertEquals(1, surface.getPaths().size());
        RecordingSurface.DrawnPath drawn = surface.getPaths().get(0);
        assertTrue(drawn.fill());
        assertFalse(drawn.stroke());
        assertEquals(Color.RED, drawn.fillColor());
        assertEquals(List.of(new MoveTo(36, 36), new LineTo(324, 36), new LineTo(324, 252), new LineTo(36, 252),
                new Close()), drawn.path().getSegments());
        assertEquals(0, surface.getDepth());
    }

    @Test
    void panelOffsetIsAdded() {
        Shape.Circle circle = new Shape.Circle(ShapeStyle.builder().fillColor(Color.BLUE).build(), 1, 1, 0.5);

        renderer.render(surface, circle, 0, 5.5);

        var bounds = surface.getPaths().get(0).path().getBounds();
        assertEquals(36.0, bounds.getMinX(), 1e-9);
        assertEquals(108.0, bounds.getMaxX(), 1e-9);
        assertEquals(432.0, bounds.getMinY(), 1e-9);
        assertEquals(504.0, bounds.getMaxY(), 1e-9);
    }

    @Test
    void rotationPivotsAroundRectangleCenter() {
        Shape.Rectangle rect = new Shape.Rectangle(
                ShapeStyle.builder().fillColor(Color.RED).rotation(45).opacity(0.5).build(), 0.5, 0.5, 4, 3);

        renderer.render(surface, rect, 0, 0);

        assertTrue(surface.getOps().contains("rotate 180.0 144.0 45.0"));
        assertTrue(surface.getOps().contains("opacity 0.5"));
        assertEquals(0, surface.getDepth());
    }

    @Test
    void strokeOnlyWithoutFill() {
        Shape.Triangle triangle = new Shape.Triangle(ShapeStyle.builder().stroke(Color.BLACK, 2).build(),
                new Point(0, 0), new Point(1, 0), new Point(0.5, 1));

        renderer.render(surface, triangle, 0, 0);

        RecordingSurface.DrawnPath drawn = surface.getPaths().get(0);
        assertFalse(drawn.fill());
        assertTrue(drawn.stroke());
        assertEquals(2.0, drawn.lineWidth(), 1e-9);
    }

    @Test
    void lineDefaultsToBlackHairline() {
        Shape.Line line = new Shape.Line(ShapeStyle.builder().build(), new Point(0, 0), new Point(1, 1));

        renderer.render(surface, line, 0, 0);

        RecordingSurface.DrawnPath drawn = surface.getPaths().get(0);
        assertTrue(drawn.stroke());
        assertEquals(Color.BLACK, drawn.strokeColor());
        assertEquals(1.0, drawn.lineWidth(), 1e-9);
    }

    @Test
    void starHasTwoVerticesPerPoint() {
        Shape.Star star = new Shape.Star(ShapeStyle.builder().fillColor(Color.GOLD).build(), 2, 2, 1, 0.4, 5);

        renderer.render(surface, star, 0, 0);

        // move + 9 lines + close
        assertEquals(11, surface.getPaths().get(0).path().getSegments().size());
    }

    @Test
    void gradientIsClippedToOutline() {
        Shape.Circle circle = new Shape.Circle(
                ShapeStyle.builder().fill(new FillStyle.LinearGradient(90, STOPS)).build(), 1, 1, 0.5);

        ElementOutcome outcome = renderer.render(surface, circle, 0, 0);

        assertEquals(ElementOutcome.Status.RENDERED, outcome.status());
        List<String> ops = surface.getOps();
        int clip = ops.indexOf(surface.opsStartingWith("clip").get(0));
        assertTrue(clip >= 0 && clip < ops.indexOf("linearGradient 2"));
        assertEquals(0, surface.getDepth());
    }

    @Test
    void unsupportedGradientDegradesToFirstStop() {
        RecordingSurface plain = new RecordingSurface().withoutGradients();
        Shape.Rectangle rect = new Shape.Rectangle(
                ShapeStyle.builder().fill(FillStyle.RadialGradient.centered(STOPS)).build(), 0, 0, 1, 1);

        ElementOutcome outcome = renderer.render(plain, rect, 0, 0);

        assertEquals(ElementOutcome.Status.DEGRADED, outcome.status());
        assertEquals(1, plain.getPaths().size());
        assertEquals(Color.fromHex("#ff0000"), plain.getPaths().get(0).fillColor());
        assertEquals(0, plain.getDepth());
    }

    @Test
    void pathWithArcIsDegraded() {
        Shape.Path path = new Shape.Path(ShapeStyle.builder().stroke(Color.BLACK, 1).build(),
                "M 0 0 A 1 1 0 0 1 1 1", 1.0);

        ElementOutcome outcome = renderer.render(surface, path, 0, 0);

        assertEquals(ElementOutcome.Status.DEGRADED, outcome.status());
        assertTrue(outcome.message().contains("arc"));
    }

    @Test
    void unparsablePathIsSkipped() {
        Shape.Path path = new Shape.Path(ShapeStyle.builder().fillColor(Color.RED).build(), "10 20 L 5 5", 1.0);

        ElementOutcome outcome = renderer.render(surface, path, 0, 0);

        assertEquals(ElementOutcome.Status.SKIPPED, outcome.status());
        assertTrue(surface.getPaths().isEmpty());
        assertEquals(0, surface.getDepth());
    }
}
