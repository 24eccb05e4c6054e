package nl.bytesoflife.deltacard.model;

import java.util.List;
import java.util.UUID;

/**
 * A rectangular face of the card with its own origin. x and y are inches from the page's
 * lower-left corner; element coordinates are relative to the panel.
 */
public record Panel(String id, PanelPosition position, double x, double y, double width, double height,
                    double rotation, Color backgroundColor, Border border,
                    List<Shape> shapes, List<TextElement> texts, List<ImageElement> images) {

    public Panel {
        if (id == null || id.isEmpty()) {
            id = UUID.randomUUID().toString();
        }
        Checks.required("position", position);
        Checks.nonNegative("x", x);
        Checks.nonNegative("y", y);
        Checks.positive("width", width);
        Checks.positive("height", height);
        Checks.finite("rotation", rotation);
        shapes = shapes == null ? List.of() : List.copyOf(shapes);
        texts = texts == null ? List.of() : List.copyOf(texts);
        images = images == null ? List.of() : List.copyOf(images);
    }

    public Panel(PanelPosition position, double x, double y, double width, double height) {
        this(null, position, x, y, width, height, 0.0, null, null, List.of(), List.of(), List.of());
    }

    public Panel withElements(List<Shape> shapes, List<TextElement> texts, List<ImageElement> images) {
        return new Panel(id, position, x, y, width, height, rotation, backgroundColor, border,
                shapes, texts, images);
    }

    public Panel withBackground(Color backgroundColor, Border border) {
        return new Panel(id, position, x, y, width, height, rotation, backgroundColor, border,
                shapes, texts, images);
    }
}
