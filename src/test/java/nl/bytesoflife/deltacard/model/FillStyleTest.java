package nl.bytesoflife.deltacard.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FillStyleTest {

    private static final List<ColorStop> TWO_STOPS = List.of(
            ColorStop.of(0.0, "#ff0000"), ColorStop.of(1.0, "#0000ff"));

    @Test
    void patternAcceptsUpperBounds() {
        FillStyle.Pattern pattern = new FillStyle.Pattern(PatternKind.DOTS,
                List.of(Color.RED, Color.GREEN, Color.BLUE, Color.GOLD), 2.0, 5.0, 0.0);
        assertEquals(4, pattern.colors().size());
        assertEquals("pattern", pattern.type());
        assertEquals(Color.RED, pattern.fallbackColor());
    }

    @Test
    void patternRejectsOutOfRangeValues() {
        List<Color> one = List.of(Color.RED);
        assertThrows(ValidationException.class, () -> new FillStyle.Pattern(PatternKind.GRID, one, 2.01, 1.0, 0.0));
        assertThrows(ValidationException.class, () -> new FillStyle.Pattern(PatternKind.GRID, one, 0.0, 1.0, 0.0));
        assertThrows(ValidationException.class, () -> new FillStyle.Pattern(PatternKind.GRID, one, 0.25, 5.01, 0.0));
        assertThrows(ValidationException.class, () -> new FillStyle.Pattern(PatternKind.GRID, one, 0.25, 1.0, 360.0));
        assertThrows(ValidationException.class, () -> new FillStyle.Pattern(PatternKind.GRID, List.of()));
        assertThrows(ValidationException.class, () -> new FillStyle.Pattern(PatternKind.GRID,
                List.of(Color.RED, Color.GREEN, Color.BLUE, Color.GOLD, Color.SILVER)));
    }

    @Test
    void gradientNeedsTwoToTwentyOrderedStops() {
        assertDoesNotThrow(() -> new FillStyle.LinearGradient(0.0, TWO_STOPS));
        assertThrows(ValidationException.class,
                () -> new FillStyle.LinearGradient(0.0, List.of(ColorStop.of(0.0, "#ffffff"))));

        List<ColorStop> many = new ArrayList<>();
        for (int i = 0; i <= 20; i++) {
            many.add(ColorStop.of(i / 20.0, "#ffffff"));
        }
        assertThrows(ValidationException.class, () -> new FillStyle.LinearGradient(0.0, many));
        assertDoesNotThrow(() -> new FillStyle.LinearGradient(0.0, many.subList(0, 20)));

        List<ColorStop> unordered = List.of(ColorStop.of(0.8, "#ffffff"), ColorStop.of(0.2, "#000000"));
        assertThrows(ValidationException.class, () -> new FillStyle.LinearGradient(0.0, unordered));
    }

    @Test
    void nullElementsAreValidationErrors() {
        List<ColorStop> stops = Arrays.asList(ColorStop.of(0.0, "#ffffff"), null);
        assertThrows(ValidationException.class, () -> new FillStyle.LinearGradient(0.0, stops));
        assertThrows(ValidationException.class, () -> new FillStyle.RadialGradient(0.5, 0.5, 0.5, stops));

        List<Color> colors = Arrays.asList(Color.RED, null);
        ValidationException e = assertThrows(ValidationException.class,
                () -> new FillStyle.Pattern(PatternKind.STRIPES, colors));
        assertEquals("colors[1] is required", e.getMessage());
    }

    @Test
    void gradientAngleAndRadiusRanges() {
        assertThrows(ValidationException.class, () -> new FillStyle.LinearGradient(360.0, TWO_STOPS));
        assertDoesNotThrow(() -> new FillStyle.LinearGradient(359.9, TWO_STOPS));
        assertThrows(ValidationException.class, () -> new FillStyle.RadialGradient(0.5, 0.5, 0.0, TWO_STOPS));
        assertDoesNotThrow(() -> new FillStyle.RadialGradient(0.5, 0.5, 1.0, TWO_STOPS));
        assertEquals(0.5, FillStyle.RadialGradient.centered(TWO_STOPS).radius(), 1e-9);
    }

    @Test
    void effectiveFillPrefersFillOverFillColor() {
        FillStyle gradient = new FillStyle.LinearGradient(90.0, TWO_STOPS);
        ShapeStyle both = ShapeStyle.builder().fill(gradient).fillColor(Color.RED).build();
        assertSame(gradient, both.effectiveFill());

        ShapeStyle colorOnly = ShapeStyle.builder().fillColor(Color.RED).build();
        assertEquals(new FillStyle.Solid(Color.RED), colorOnly.effectiveFill());

        assertNull(ShapeStyle.builder().build().effectiveFill());
    }
}
