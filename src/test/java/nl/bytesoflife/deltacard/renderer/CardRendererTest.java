package nl.bytesoflife.deltacard.renderer;

import nl.bytesoflife.deltacard.decorative.DecorativeDefinition;
import nl.bytesoflife.deltacard.decorative.DecorativeLibrary;
import nl.bytesoflife.deltacard.model.*;
import nl.bytesoflife.deltacard.surface.ImageSize;
import nl.bytesoflife.deltacard.surface.RecordingSurface;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CardRendererTest {

    private final DecorativeLibrary library = new DecorativeLibrary().register(new DecorativeDefinition(
            "heart", "Simple heart", 1, 1, Map.of("primary", "#ff69b4"),
            List.of(Map.of("type", "circle", "center_x", 0.5, "center_y", 0.5, "radius", 0.5,
                    "fill_color", "{primary}"))));

    private final RecordingSurface surface = new RecordingSurface();

    private CardRenderer renderer(RenderOptions options) {
        return new CardRenderer(options, library);
    }

    private CardRenderer renderer() {
        return renderer(RenderOptions.defaults().setDrawFoldLines(false));
    }

    private static Panel panel() {
        return new Panel(PanelPosition.FRONT, 0, 0, 8.5, 5.5);
    }

    private static Card card(Panel panel) {
        return new Card("Test", FoldType.HALF_FOLD, List.of(panel));
    }

    private static Shape.Rectangle rect(Color color, int zIndex) {
        return new Shape.Rectangle(ShapeStyle.builder().fillColor(color).zIndex(zIndex).build(), 1, 1, 2, 2);
    }

    @Test
    void beginsLetterPage() {
        renderer().render(card(panel()), surface);

        assertEquals("page 612.0 792.0", surface.getOps().get(0));
    }

    @Test
    void drawsElementsInLayerOrder() {
        Panel panel = panel().withElements(List.of(rect(Color.RED, 5), rect(Color.BLUE, 1), rect(Color.GREEN, 5)),
                List.of(), List.of());

        RenderReport report = renderer().render(card(panel), surface);

        List<Color> fills = surface.getPaths().stream().map(RecordingSurface.DrawnPath::fillColor).toList();
        assertEquals(List.of(Color.BLUE, Color.RED, Color.GREEN), fills);
        assertTrue(report.isClean());
        assertEquals(3, report.getRenderedCount());
        assertEquals(0, surface.getDepth());
    }

    @Test
    void equalLayersKeepShapesImagesTextOrder() {
        TextElement text = TextElement.builder("Hi").zIndex(0).build();
        ImageElement image = ImageElement.builder("a.png").zIndex(0).build();
        Panel panel = panel().withElements(List.of(rect(Color.RED, 0)), List.of(text), List.of(image));

        List<CardRenderer.Layered> sorted = CardRenderer.sortedElements(panel);

        assertInstanceOf(Shape.class, sorted.get(0).element());
        assertInstanceOf(ImageElement.class, sorted.get(1).element());
        assertInstanceOf(TextElement.class, sorted.get(2).element());
    }

    @Test
    void failingElementDoesNotStopOthers() {
        Shape.Path broken = new Shape.Path(ShapeStyle.builder().fillColor(Color.RED).build(), "10 20 L 5 5", 1.0);
        Panel panel = panel().withElements(List.of(broken, rect(Color.BLUE, 1)), List.of(), List.of());

        RenderReport report = renderer().render(card(panel), surface);

        assertEquals(1, report.getSkipped().size());
        assertEquals(broken.id(), report.getSkipped().get(0).elementId());
        assertEquals(1, report.getRenderedCount());
        assertEquals(1, surface.getPaths().size());
        assertTrue(report.toString().startsWith("Render Report:\n  Elements: 2 (1 rendered, 0 degraded, 1 skipped)"));
    }

    @Test
    void halfFoldDrawsHorizontalGuide() {
        renderer(RenderOptions.defaults()).render(card(panel()), surface);

        assertEquals(1, surface.getPaths().size());
        assertEquals(new Envelope(0, 612, 396, 396), surface.getPaths().get(0).path().getBounds());
        assertTrue(surface.getOps().contains("dash [3.0, 3.0]"));
        assertEquals(0, surface.getDepth());
    }

    @Test
    void quarterAndTriFoldGuides() {
        Card quarter = new Card("Q", FoldType.QUARTER_FOLD, List.of(panel()));
        renderer(RenderOptions.defaults()).render(quarter, surface);
        assertEquals(2, surface.getPaths().size());
        assertEquals(new Envelope(306, 306, 0, 792), surface.getPaths().get(1).path().getBounds());

        RecordingSurface tri = new RecordingSurface();
        renderer(RenderOptions.defaults()).render(new Card("T", FoldType.TRI_FOLD, List.of(panel())), tri);
        assertEquals(2, tri.getPaths().size());
        assertEquals(204.0, tri.getPaths().get(0).path().getBounds().getMinX(), 1e-9);
        assertEquals(408.0, tri.getPaths().get(1).path().getBounds().getMinX(), 1e-9);
    }

    @Test
    void noGuidesWhenDisabled() {
        renderer().render(card(panel()), surface);

        assertTrue(surface.getPaths().isEmpty());
    }

    @Test
    void backgroundAndDashedBorder() {
        Panel panel = panel().withBackground(Color.WHITE, new Border(BorderStyle.DASHED, 2, Color.BLACK, 0));

        renderer().render(card(panel), surface);

        RecordingSurface.DrawnPath background = surface.getPaths().get(0);
        assertTrue(background.fill());
        assertEquals(new Envelope(0, 612, 0, 396), background.path().getBounds());
        RecordingSurface.DrawnPath border = surface.getPaths().get(1);
        assertTrue(border.stroke());
        assertFalse(border.fill());
        assertEquals(2.0, border.lineWidth(), 1e-9);
        assertTrue(surface.getOps().contains("dash [6.0, 3.0]"));
    }

    @Test
    void rotatedPanelTurnsAboutItsCenter() {
        Panel base = panel();
        Panel rotated = new Panel(base.id(), base.position(), 0, 0, 8.5, 5.5, 180, null, null,
                List.of(), List.of(), List.of());

        renderer().render(card(rotated), surface);

        assertTrue(surface.getOps().contains("rotate 306.0 198.0 180.0"));
    }

    @Test
    void missingImageIsSkipped() {
        ImageElement image = ImageElement.builder("missing.png").at(1, 1).build();
        Panel panel = panel().withElements(List.of(rect(Color.RED, 0)), List.of(), List.of(image));

        RenderReport report = renderer().render(card(panel), surface);

        assertEquals(1, report.getSkipped().size());
        assertEquals("image", report.getSkipped().get(0).elementType());
        assertTrue(surface.getImages().isEmpty());
        assertEquals(1, surface.getPaths().size());
        assertEquals(0, surface.getDepth());
    }

    @Test
    void imageIsSizedAndClampedToSafeArea() {
        surface.withImage("photo.png", new ImageSize(4, 2));
        ImageElement image = ImageElement.builder("photo.png").at(0, 0).size(2.0, null).build();
        Panel panel = panel().withElements(List.of(), List.of(), List.of(image));

        renderer().render(card(panel), surface);

        RecordingSurface.DrawnImage drawn = surface.getImages().get(0);
        assertEquals(18.0, drawn.x(), 1e-9);
        assertEquals(18.0, drawn.y(), 1e-9);
        assertEquals(144.0, drawn.width(), 1e-9);
        assertEquals(72.0, drawn.height(), 1e-9);
    }

    @Test
    void imageIsNotClampedWhenDisabled() {
        surface.withImage("photo.png", new ImageSize(4, 2));
        ImageElement image = ImageElement.builder("photo.png").at(0, 0).size(2.0, null).build();
        Panel panel = panel().withElements(List.of(), List.of(), List.of(image));

        renderer(RenderOptions.defaults().setDrawFoldLines(false).setClampImagesToSafeArea(false))
                .render(card(panel), surface);

        assertEquals(0.0, surface.getImages().get(0).x(), 1e-9);
    }

    @Test
    void clippedImageIsDrawnInsideClip() {
        surface.withImage("photo.png", new ImageSize(2, 2));
        ImageElement image = ImageElement.builder("photo.png").at(1, 1).size(2.0, 2.0)
                .clipMask(new ClipMask.Circle(1, 1, 1)).build();
        Panel panel = panel().withElements(List.of(), List.of(), List.of(image));

        RenderReport report = renderer().render(card(panel), surface);

        List<String> ops = surface.getOps();
        int clip = ops.indexOf(surface.opsStartingWith("clip").get(0));
        assertTrue(clip < ops.indexOf("image photo.png"));
        assertEquals(2, surface.getImages().get(0).depth());
        assertTrue(report.isClean());
        assertEquals(0, surface.getDepth());
    }

    @Test
    void textIsAlignedOnItsAnchor() {
        TextElement text = TextElement.builder("Hello").at(1, 1).alignment(TextAlignment.CENTER).build();
        Panel panel = panel().withElements(List.of(), List.of(text), List.of());

        renderer().render(card(panel), surface);

        RecordingSurface.DrawnText drawn = surface.getTexts().get(0);
        assertEquals("Hello", drawn.text());
        assertEquals(57.0, drawn.x(), 1e-9);
        assertEquals(72.0, drawn.y(), 1e-9);
        assertEquals("Helvetica", drawn.font());
        assertEquals(12.0, drawn.size(), 1e-9);
        assertEquals(Color.BLACK, drawn.color());
    }

    @Test
    void wrappedTextStacksLinesDownwards() {
        TextElement text = TextElement.builder("Wishing you all the best on your special day")
                .at(1, 4).width(1.5).font("Times", 12, FontStyle.BOLD).color(Color.RED).build();
        Panel panel = panel().withElements(List.of(), List.of(text), List.of());

        RenderReport report = renderer().render(card(panel), surface);

        List<RecordingSurface.DrawnText> lines = surface.getTexts();
        assertTrue(lines.size() > 1);
        assertEquals(288.0, lines.get(0).y(), 1e-9);
        assertEquals(288.0 - 12 * 1.2, lines.get(1).y(), 1e-9);
        assertEquals("Times-Bold", lines.get(0).font());
        assertEquals(Color.RED, lines.get(0).color());
        assertTrue(report.getTextAdjustments().get(text.id()).wasAdjusted());
    }

    @Test
    void decorativeElementExpandsIntoShapes() {
        Shape.DecorativeRef heart = new Shape.DecorativeRef(null, "heart", 2, 2, 2, 0, Map.of(), 0);
        Panel panel = panel().withElements(List.of(heart), List.of(), List.of());

        RenderReport report = renderer().render(card(panel), surface);

        assertEquals(1, surface.getPaths().size());
        assertEquals(Color.fromHex("#ff69b4"), surface.getPaths().get(0).fillColor());
        assertEquals(new Envelope(144, 288, 144, 288), surface.getPaths().get(0).path().getBounds());
        assertTrue(report.isClean());
    }

    @Test
    void unknownDecorativeElementIsSkipped() {
        Shape.DecorativeRef unknown = new Shape.DecorativeRef("unicorn", 1, 1);
        Panel panel = panel().withElements(List.of(unknown, rect(Color.RED, 1)), List.of(), List.of());

        RenderReport report = renderer().render(card(panel), surface);

        assertEquals(1, report.getSkipped().size());
        assertTrue(report.getSkipped().get(0).message().contains("Available: heart"));
        assertEquals(1, surface.getPaths().size());
    }

    @Test
    void imageSizeRules() {
        ImageSize natural = new ImageSize(4, 2);

        assertEquals(new ImageSize(2, 1), CardRenderer.fitImageSize(natural, 2.0, null, true, 8.5, 5.5));
        assertEquals(new ImageSize(4, 1), CardRenderer.fitImageSize(natural, null, 1.0, false, 8.5, 5.5));
        assertEquals(new ImageSize(2, 1), CardRenderer.fitImageSize(natural, 2.0, 2.0, true, 8.5, 5.5));
        assertEquals(new ImageSize(2, 2), CardRenderer.fitImageSize(natural, 2.0, 2.0, false, 8.5, 5.5));
        assertEquals(new ImageSize(4, 2), CardRenderer.fitImageSize(natural, null, null, true, 8.5, 5.5));
        assertEquals(new ImageSize(3, 1.5), CardRenderer.fitImageSize(natural, null, null, true, 3, 3));
    }
}
