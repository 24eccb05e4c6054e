package nl.bytesoflife.deltacard.parser;

import nl.bytesoflife.deltacard.model.*;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SceneElementParserTest {

    private final SceneElementParser parser = new SceneElementParser();

    @Test
    void parsesRectangleWithStyle() {
        Shape shape = parser.parseShape(Map.of(
                "type", "rectangle", "id", "r1", "x", 0.5, "y", 0.5, "width", 4, "height", 3,
                "fill_color", "#ff0000", "stroke_color", "#000000", "stroke_width", 2, "z_index", 4));

        Shape.Rectangle rect = assertInstanceOf(Shape.Rectangle.class, shape);
        assertEquals("r1", rect.id());
        assertEquals(4, rect.zIndex());
        assertEquals(4.0, rect.width(), 1e-9);
        assertEquals(Color.fromHex("#ff0000"), rect.style().fillColor());
        assertTrue(rect.style().hasStroke());
    }

    @Test
    void rejectsIntegerFieldsOutsideIntRange() {
        ValidationException e = assertThrows(ValidationException.class, () -> parser.parseShape(Map.of(
                "type", "rectangle", "x", 0.5, "y", 0.5, "width", 1, "height", 1, "z_index", 1e12)));
        assertTrue(e.getMessage().contains("z_index"));

        assertThrows(ValidationException.class, () -> parser.parseShape(Map.of("type", "star",
                "center_x", 2, "center_y", 2, "outer_radius", 1, "inner_radius", 0.4, "points", "-3000000000")));
    }

    @Test
    void starDefaultsToFivePoints() {
        Shape.Star star = (Shape.Star) parser.parseShape(Map.of("type", "star",
                "center_x", 2, "center_y", 2, "outer_radius", 1, "inner_radius", 0.4));
        assertEquals(5, star.points());
    }

    @Test
    void parsesGradientFillAndRgbColors() {
        Map<String, Object> fill = Map.of("type", "linear_gradient", "angle", 90,
                "stops", List.of(
                        Map.of("position", 0.0, "color", "#ffffff"),
                        Map.of("position", 1.0, "color", Map.of("r", 0.0, "g", 0.0, "b", 1.0))));
        Shape shape = parser.parseShape(Map.of("type", "circle", "center_x", 1, "center_y", 1, "radius", 0.5,
                "fill", fill));

        FillStyle.LinearGradient gradient =
                assertInstanceOf(FillStyle.LinearGradient.class, ((Shape.Circle) shape).style().fill());
        assertEquals(90.0, gradient.angle(), 1e-9);
        assertEquals(new Color(0, 0, 1), gradient.stops().get(1).color());
    }

    @Test
    void parsesPatternFillWithDefaults() {
        FillStyle fill = parser.parseFill(Map.of("type", "pattern", "pattern_type", "checkerboard",
                "colors", List.of("#000000", "#ffffff")));

        FillStyle.Pattern pattern = assertInstanceOf(FillStyle.Pattern.class, fill);
        assertEquals(PatternKind.CHECKERBOARD, pattern.kind());
        assertEquals(FillStyle.Pattern.DEFAULT_SPACING, pattern.spacing(), 1e-9);
        assertEquals(1.0, pattern.scale(), 1e-9);
    }

    @Test
    void parsesDecorativeReference() {
        Shape shape = parser.parseShape(Map.of("type", "decorative_element", "name", "heart",
                "x", 1, "y", 2, "scale", 1.5, "color_palette", Map.of("primary", "#ff69b4")));

        Shape.DecorativeRef ref = assertInstanceOf(Shape.DecorativeRef.class, shape);
        assertEquals("heart", ref.name());
        assertEquals(1.5, ref.scale(), 1e-9);
        assertEquals("#ff69b4", ref.palette().get("primary"));
    }

    @Test
    void parsesTextAndImage() {
        TextElement text = parser.parseText(Map.of("content", "Happy Birthday", "x", 1, "y", 2,
                "width", 3, "font_size", 24, "font_style", "bold", "alignment", "center",
                "overflow_strategy", "wrap", "max_lines", 2));
        assertEquals(24, text.fontSize());
        assertEquals(FontStyle.BOLD, text.fontStyle());
        assertEquals(TextAlignment.CENTER, text.alignment());
        assertEquals(OverflowPolicy.WRAP, text.overflowPolicy());
        assertEquals(2, text.maxLines());
        assertEquals(100, text.zIndex());

        ImageElement image = parser.parseImage(Map.of("source_path", "photo.png", "x", 0, "y", 0,
                "width", 2, "clip_mask", Map.of("type", "circle", "center_x", 1, "center_y", 1, "radius", 1)));
        assertEquals(2.0, image.width(), 1e-9);
        assertNull(image.height());
        assertTrue(image.preserveAspect());
        assertInstanceOf(ClipMask.Circle.class, image.clipMask());
    }

    @Test
    void parsesCard() {
        Map<String, Object> panel = new HashMap<>();
        panel.put("position", "front");
        panel.put("x", 0);
        panel.put("y", 0);
        panel.put("width", 8.5);
        panel.put("height", 5.5);
        panel.put("background_color", "#fff8dc");
        panel.put("border", Map.of("style", "dashed", "width", 2, "color", "#000000"));
        panel.put("text_elements", List.of(Map.of("content", "Hello", "x", 1, "y", 1)));

        Card card = parser.parseCard(Map.of("name", "Greeting", "fold_type", "half_fold", "panels", List.of(panel)));

        assertEquals(FoldType.HALF_FOLD, card.foldType());
        Panel front = card.panels().get(0);
        assertEquals(PanelPosition.FRONT, front.position());
        assertEquals(BorderStyle.DASHED, front.border().style());
        assertEquals(1, front.texts().size());
    }

    @Test
    void rejectsUnknownTypesAndBadValues() {
        assertThrows(ValidationException.class, () -> parser.parseShape(Map.of("type", "hexagon")));
        assertThrows(ValidationException.class, () -> parser.parseFill(Map.of("type", "noise")));
        assertThrows(ValidationException.class, () -> parser.parseClipMask(Map.of("type", "blob")));
        assertThrows(ValidationException.class, () -> parser.parseShape(Map.of("type", "circle",
                "center_x", "left", "center_y", 1, "radius", 1)));
        assertThrows(ValidationException.class, () -> parser.parseShape(Map.of("type", "rectangle",
                "x", 0, "y", 0, "width", 1)));
        assertThrows(ValidationException.class, () -> parser.parseText(Map.of("content", "x", "x", 0, "y", 0,
                "font_size", 12.5)));
    }
}
