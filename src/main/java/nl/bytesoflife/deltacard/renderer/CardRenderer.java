package nl.bytesoflife.deltacard.renderer;

import nl.bytesoflife.deltacard.decorative.DecorativeExpander;
import nl.bytesoflife.deltacard.decorative.DecorativeLibrary;
import nl.bytesoflife.deltacard.model.Border;
import nl.bytesoflife.deltacard.model.Card;
import nl.bytesoflife.deltacard.model.FoldType;
import nl.bytesoflife.deltacard.model.ImageElement;
import nl.bytesoflife.deltacard.model.Panel;
import nl.bytesoflife.deltacard.model.Shape;
import nl.bytesoflife.deltacard.model.TextElement;
import nl.bytesoflife.deltacard.model.Units;
import nl.bytesoflife.deltacard.surface.DrawingSurface;
import nl.bytesoflife.deltacard.surface.ImageSize;
import nl.bytesoflife.deltacard.surface.SurfacePath;
import nl.bytesoflife.deltacard.text.FitResult;
import nl.bytesoflife.deltacard.text.FontNames;
import nl.bytesoflife.deltacard.text.TextFitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Draws a whole card onto one page: panels in order, each panel's elements bottom-to-top by
 * (z-index, declaration order), then the fold guides.
 * <p>
 * A failing element is logged and recorded in the {@link RenderReport}; it never stops the
 * remaining elements or panels.
 */
public class CardRenderer {

    private static final Logger log = LoggerFactory.getLogger(CardRenderer.class);

    private final RenderOptions options;
    private final ShapeRenderer shapeRenderer;
    private final ClippingRenderer clippingRenderer;
    private final DecorativeExpander decorativeExpander;

    public CardRenderer(RenderOptions options, DecorativeLibrary library) {
        this(options, new ShapeRenderer(options), new ClippingRenderer(options), new DecorativeExpander(library));
    }

    public CardRenderer(RenderOptions options, ShapeRenderer shapeRenderer, ClippingRenderer clippingRenderer,
                        DecorativeExpander decorativeExpander) {
        this.options = options;
        this.shapeRenderer = shapeRenderer;
        this.clippingRenderer = clippingRenderer;
        this.decorativeExpander = decorativeExpander;
    }

    /**
     * An element of a panel with its layer and position in the panel's declaration order.
     */
    record Layered(Object element, int zIndex, int order) {
    }

    public RenderReport render(Card card, DrawingSurface surface) {
        RenderReport report = new RenderReport();
        TextFitter fitter = options.createTextFitter(surface);

        surface.beginPage(pt(Units.PAGE_WIDTH), pt(Units.PAGE_HEIGHT));
        for (Panel panel : card.panels()) {
            try {
                renderPanel(surface, panel, fitter, report);
            } catch (RuntimeException e) {
                log.error("Failed to render panel {} ({}): {}", panel.position().getKey(), panel.id(), e.getMessage());
                log.debug("Panel failure", e);
                report.addOutcome(ElementOutcome.skipped(panel.id(), "panel", e.getMessage()));
            }
        }
        if (options.isDrawFoldLines()) {
            drawFoldLines(surface, card.foldType());
        }

        log.info("Rendered card '{}' ({}): {} elements, {} degraded, {} skipped", card.name(),
                card.foldType().getKey(), report.getOutcomes().size(), report.getDegraded().size(),
                report.getSkipped().size());
        return report;
    }

    void renderPanel(DrawingSurface surface, Panel panel, TextFitter fitter, RenderReport report) {
        double x = pt(panel.x());
        double y = pt(panel.y());
        double width = pt(panel.width());
        double height = pt(panel.height());

        surface.pushState();
        try {
            if (panel.rotation() != 0) {
                surface.rotateAbout(x + width / 2, y + height / 2, panel.rotation());
            }
            if (panel.backgroundColor() != null) {
                surface.setFillColor(panel.backgroundColor());
                surface.drawPath(SurfacePath.rect(x, y, width, height), true, false);
            }
            if (panel.border() != null) {
                drawBorder(surface, x, y, width, height, panel.border());
            }
            for (Layered layered : sortedElements(panel)) {
                renderElement(surface, layered.element(), panel, fitter, report);
            }
        } finally {
            surface.popState();
        }
    }

    /**
     * Shapes, then images, then text, stably sorted by z-index.
     */
    static List<Layered> sortedElements(Panel panel) {
        List<Layered> elements = new ArrayList<>();
        int order = 0;
        for (Shape shape : panel.shapes()) {
            elements.add(new Layered(shape, shape.zIndex(), order++));
        }
        for (ImageElement image : panel.images()) {
            elements.add(new Layered(image, image.zIndex(), order++));
        }
        for (TextElement text : panel.texts()) {
            elements.add(new Layered(text, text.zIndex(), order++));
        }
        elements.sort(Comparator.comparingInt(Layered::zIndex).thenComparingInt(Layered::order));
        return elements;
    }

    private void renderElement(DrawingSurface surface, Object element, Panel panel, TextFitter fitter,
                               RenderReport report) {
        try {
            if (element instanceof Shape.DecorativeRef ref) {
                renderDecorative(surface, ref, panel, report);
            } else if (element instanceof Shape.Primitive shape) {
                report.addOutcome(shapeRenderer.render(surface, shape, panel.x(), panel.y()));
            } else if (element instanceof ImageElement image) {
                report.addOutcome(renderImage(surface, image, panel));
            } else if (element instanceof TextElement text) {
                report.addOutcome(renderText(surface, text, panel, fitter, report));
            } else {
                log.warn("Skipping unsupported element {}", element);
            }
        } catch (RuntimeException e) {
            String id = elementId(element);
            log.error("Failed to render element {}: {}", id, e.getMessage());
            log.debug("Element failure", e);
            report.addOutcome(ElementOutcome.skipped(id, element.getClass().getSimpleName(), e.getMessage()));
        }
    }

    private static String elementId(Object element) {
        if (element instanceof Shape shape) {
            return shape.id();
        } else if (element instanceof ImageElement image) {
            return image.id();
        } else if (element instanceof TextElement text) {
            return text.id();
        }
        return String.valueOf(element);
    }

    private void renderDecorative(DrawingSurface surface, Shape.DecorativeRef ref, Panel panel, RenderReport report) {
        DecorativeExpander.Expansion expansion;
        try {
            expansion = decorativeExpander.expand(ref);
        } catch (RenderException e) {
            log.warn("Skipping decorative element {}: {}", ref.id(), e.getMessage());
            report.addOutcome(ElementOutcome.skipped(ref.id(), ref.type(), e.getMessage()));
            return;
        }

        ElementOutcome outcome = expansion.skipped().isEmpty()
                ? ElementOutcome.rendered(ref.id(), ref.type())
                : ElementOutcome.degraded(ref.id(), ref.type(), expansion.skipped().size() + " child shape(s) skipped");
        for (Shape.Primitive child : expansion.shapes()) {
            ElementOutcome childOutcome = shapeRenderer.render(surface, child, panel.x(), panel.y());
            report.addOutcome(childOutcome);
            if (!childOutcome.isRendered()) {
                outcome = outcome.worst(ElementOutcome.degraded(ref.id(), ref.type(),
                        "child " + child.id() + " " + childOutcome.status()));
            }
        }
        report.addOutcome(outcome);
    }

    ElementOutcome renderImage(DrawingSurface surface, ImageElement image, Panel panel) {
        ImageSize natural;
        try {
            natural = surface.naturalImageSize(image.sourcePath());
        } catch (IOException e) {
            log.warn("Skipping image {}: cannot read {} ({})", image.id(), image.sourcePath(), e.getMessage());
            return ElementOutcome.skipped(image.id(), "image", "Image file not readable: " + image.sourcePath());
        }

        ImageSize size = fitImageSize(natural, image.width(), image.height(), image.preserveAspect(),
                panel.width(), panel.height());
        if (!Units.isWithinPage(panel.x() + image.x(), panel.y() + image.y(), size.width(), size.height())) {
            log.warn("Image {} ({} x {} in at {}, {}) extends outside the safe area", image.id(),
                    size.width(), size.height(), panel.x() + image.x(), panel.y() + image.y());
        }
        double width = pt(size.width());
        double height = pt(size.height());
        double x = pt(panel.x() + image.x());
        double y = pt(panel.y() + image.y());
        if (options.isClampImagesToSafeArea()) {
            double margin = pt(Units.SAFE_MARGIN);
            x = Math.max(margin, Math.min(x, pt(Units.PAGE_WIDTH) - margin - width));
            y = Math.max(margin, Math.min(y, pt(Units.PAGE_HEIGHT) - margin - height));
        }

        String degradation = null;
        surface.pushState();
        try {
            if (image.opacity() < 1.0) {
                surface.setOpacity(image.opacity());
            }
            if (image.rotation() != 0) {
                surface.rotateAbout(x + width / 2, y + height / 2, image.rotation());
            }
            if (image.clipMask() != null) {
                clippingRenderer.checkExtent(image.clipMask(), size.width(), size.height());
                try {
                    clippingRenderer.apply(surface, image.clipMask(), x, y);
                } catch (RenderException e) {
                    log.error("Failed to apply clip mask to image {}: {}", image.id(), e.getMessage());
                    degradation = "drawn without clip mask: " + e.getMessage();
                }
            }
            surface.drawImage(image.sourcePath(), x, y, width, height, image.preserveAspect());
        } catch (IOException e) {
            log.warn("Skipping image {}: {}", image.id(), e.getMessage());
            return ElementOutcome.skipped(image.id(), "image", "Image could not be drawn: " + e.getMessage());
        } finally {
            surface.popState();
        }
        return degradation == null
                ? ElementOutcome.rendered(image.id(), "image")
                : ElementOutcome.degraded(image.id(), "image", degradation);
    }

    /**
     * Final image size in inches. With both dimensions given and aspect preserved the image is
     * fitted inside them; with one given the other follows; with none the natural size is used,
     * shrunk to the panel.
     */
    static ImageSize fitImageSize(ImageSize natural, Double targetWidth, Double targetHeight, boolean preserveAspect,
                                  double maxWidth, double maxHeight) {
        double aspect = natural.aspectRatio();
        boolean hasWidth = targetWidth != null && targetWidth > 0;
        boolean hasHeight = targetHeight != null && targetHeight > 0;

        if (hasWidth && hasHeight) {
            if (!preserveAspect) {
                return new ImageSize(targetWidth, targetHeight);
            }
            if (targetWidth / targetHeight > aspect) {
                return new ImageSize(targetHeight * aspect, targetHeight);
            }
            return new ImageSize(targetWidth, targetWidth / aspect);
        }
        if (hasWidth) {
            return new ImageSize(targetWidth, preserveAspect ? targetWidth / aspect : natural.height());
        }
        if (hasHeight) {
            return new ImageSize(preserveAspect ? targetHeight * aspect : natural.width(), targetHeight);
        }

        double width = Math.min(natural.width(), maxWidth);
        double height = Math.min(natural.height(), maxHeight);
        if (preserveAspect) {
            double scale = Math.min(width / natural.width(), height / natural.height());
            return new ImageSize(natural.width() * scale, natural.height() * scale);
        }
        return new ImageSize(width, height);
    }

    ElementOutcome renderText(DrawingSurface surface, TextElement text, Panel panel, TextFitter fitter,
                              RenderReport report) {
        double x = pt(panel.x() + text.x());
        double y = pt(panel.y() + text.y());
        String fontName = FontNames.resolve(text.fontFamily(), text.fontStyle());

        int fontSize = text.fontSize();
        List<String> lines = List.of(text.content());
        if (text.hasWidth()) {
            FitResult fit = fitter.fit(text, fontName, pt(text.width()), pt(panel.height()));
            fontSize = fit.fontSize();
            lines = fit.lines();
            report.addTextAdjustment(text.id(), fit.adjustment());
        }

        double lineHeight = fitter.lineHeight(fontSize);
        surface.pushState();
        try {
            if (text.rotation() != 0) {
                surface.rotateAbout(x, y, text.rotation());
            }
            surface.setFont(fontName, fontSize);
            surface.setFillColor(text.color() != null ? text.color() : options.getDefaultTextColor());
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                double lineWidth = surface.measureTextWidth(line, fontName, fontSize);
                double lineX = switch (text.alignment()) {
                    case CENTER -> x - lineWidth / 2;
                    case RIGHT -> x - lineWidth;
                    case LEFT -> x;
                };
                surface.drawText(line, lineX, y - i * lineHeight);
            }
        } finally {
            surface.popState();
        }
        return ElementOutcome.rendered(text.id(), "text");
    }

    private void drawBorder(DrawingSurface surface, double x, double y, double width, double height, Border border) {
        surface.pushState();
        try {
            surface.setStrokeColor(border.color());
            surface.setLineWidth(border.width());
            surface.setDash(border.style().getDashArray());
            SurfacePath outline = border.cornerRadius() > 0
                    ? SurfacePath.roundRect(x, y, width, height, border.cornerRadius())
                    : SurfacePath.rect(x, y, width, height);
            surface.drawPath(outline, false, true);
        } finally {
            surface.popState();
        }
    }

    void drawFoldLines(DrawingSurface surface, FoldType foldType) {
        double width = pt(Units.PAGE_WIDTH);
        double height = pt(Units.PAGE_HEIGHT);

        surface.pushState();
        try {
            surface.setStrokeColor(options.getFoldLineColor());
            surface.setLineWidth(options.getFoldLineWidth());
            surface.setDash(options.getFoldLineDash());
            switch (foldType) {
                case HALF_FOLD -> surface.drawPath(SurfacePath.line(0, height / 2, width, height / 2), false, true);
                case QUARTER_FOLD -> {
                    surface.drawPath(SurfacePath.line(0, height / 2, width, height / 2), false, true);
                    surface.drawPath(SurfacePath.line(width / 2, 0, width / 2, height), false, true);
                }
                case TRI_FOLD -> {
                    double third = width / 3;
                    surface.drawPath(SurfacePath.line(third, 0, third, height), false, true);
                    surface.drawPath(SurfacePath.line(third * 2, 0, third * 2, height), false, true);
                }
            }
        } finally {
            surface.popState();
        }
    }

    private double pt(double inches) {
        return options.toPoints(inches);
    }
}
