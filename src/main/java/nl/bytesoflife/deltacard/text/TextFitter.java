package nl.bytesoflife.deltacard.text;

import nl.bytesoflife.deltacard.model.OverflowPolicy;
import nl.bytesoflife.deltacard.model.TextElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps text inside its box by shrinking, wrapping or truncating it. Widths and heights are
 * in points. The fitter never modifies its input; every call returns a fresh {@link FitResult}.
 */
public class TextFitter {

    private static final Logger log = LoggerFactory.getLogger(TextFitter.class);

    public static final String DEFAULT_ELLIPSIS = "...";
    public static final int DEFAULT_AUTO_SHRINK_THRESHOLD = 30;
    public static final double DEFAULT_LINE_HEIGHT_FACTOR = 1.2;

    private final TextMeasurer measurer;
    private final String ellipsis;
    private final int autoShrinkThreshold;
    private final double lineHeightFactor;

    public TextFitter(TextMeasurer measurer) {
        this(measurer, DEFAULT_ELLIPSIS, DEFAULT_AUTO_SHRINK_THRESHOLD, DEFAULT_LINE_HEIGHT_FACTOR);
    }

    public TextFitter(TextMeasurer measurer, String ellipsis, int autoShrinkThreshold, double lineHeightFactor) {
        this.measurer = measurer;
        this.ellipsis = ellipsis;
        this.autoShrinkThreshold = autoShrinkThreshold;
        this.lineHeightFactor = lineHeightFactor;
    }

    public double lineHeight(int fontSize) {
        return fontSize * lineHeightFactor;
    }

    /**
     * Resolve {@link OverflowPolicy#AUTO}: short text shrinks, longer text with a width wraps.
     */
    public OverflowPolicy selectPolicy(TextElement text) {
        OverflowPolicy policy = text.overflowPolicy();
        if (policy != OverflowPolicy.AUTO) {
            return policy;
        }
        if (text.content().length() < autoShrinkThreshold) {
            return OverflowPolicy.SHRINK;
        }
        return text.width() != null ? OverflowPolicy.WRAP : OverflowPolicy.SHRINK;
    }

    /**
     * Fit a text element into {@code maxWidth}. {@code maxHeight} bounds the wrapped block;
     * pass null when there is no vertical limit.
     */
    public FitResult fit(TextElement text, String fontName, double maxWidth, Double maxHeight) {
        OverflowPolicy policy = selectPolicy(text);
        int originalSize = text.fontSize();
        String content = text.content();

        int finalSize;
        List<String> lines;
        boolean truncated;
        switch (policy) {
            case SHRINK -> {
                finalSize = shrinkToFit(content, fontName, originalSize, maxWidth, text.minFontSize());
                String fitted = content;
                if (finalSize <= text.minFontSize() && measure(content, fontName, finalSize) > maxWidth) {
                    fitted = truncate(content, fontName, finalSize, maxWidth);
                }
                lines = List.of(fitted);
                truncated = !fitted.equals(content) && fitted.endsWith(ellipsis);
            }
            case WRAP -> {
                WrapFit wrapped = wrapToFit(text, fontName, maxWidth, maxHeight);
                finalSize = wrapped.fontSize();
                lines = wrapped.lines();
                truncated = false;
            }
            case TRUNCATE -> {
                finalSize = originalSize;
                String fitted = truncate(content, fontName, originalSize, maxWidth);
                lines = List.of(fitted);
                truncated = !fitted.equals(content);
            }
            default -> throw new IllegalStateException("Unresolved overflow policy: " + policy);
        }

        boolean adjusted = finalSize != originalSize || truncated || lines.size() > 1;
        AdjustmentResult adjustment = new AdjustmentResult(adjusted, policy, originalSize, finalSize,
                lines.size(), truncated);
        if (adjusted) {
            log.debug("Fitted text '{}': {}", abbreviate(content), adjustment);
        }
        return new FitResult(finalSize, lines, adjustment);
    }

    /**
     * Largest integer size in [minSize, initialSize] at which the single line fits, found by
     * binary search. Returns {@code minSize} when nothing fits.
     */
    public int shrinkToFit(String content, String fontName, int initialSize, double maxWidth, int minSize) {
        if (initialSize <= minSize) {
            return initialSize;
        }
        int low = minSize;
        int high = initialSize;
        int best = minSize;
        while (low <= high) {
            int mid = (low + high) / 2;
            if (measure(content, fontName, mid) <= maxWidth) {
                best = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return best;
    }

    /**
     * Greedy word wrap. A word wider than {@code maxWidth} on its own gets a line to itself.
     * {@code maxLines} may be null for no limit.
     */
    public List<String> wrapText(String content, String fontName, int fontSize, double maxWidth, Integer maxLines) {
        String[] words = content.trim().split("\\s+");
        List<String> lines = new ArrayList<>();
        List<String> current = new ArrayList<>();

        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            List<String> candidate = new ArrayList<>(current);
            candidate.add(word);
            if (measure(String.join(" ", candidate), fontName, fontSize) <= maxWidth) {
                current.add(word);
            } else if (!current.isEmpty()) {
                lines.add(String.join(" ", current));
                current = new ArrayList<>();
                current.add(word);
            } else {
                lines.add(word);
            }
            if (maxLines != null && lines.size() >= maxLines) {
                break;
            }
        }
        if (!current.isEmpty() && (maxLines == null || lines.size() < maxLines)) {
            lines.add(String.join(" ", current));
        }
        if (maxLines != null && lines.size() > maxLines) {
            return new ArrayList<>(lines.subList(0, maxLines));
        }
        return lines;
    }

    /**
     * Drop trailing characters until the text plus ellipsis fits. Text that already fits is
     * returned unchanged.
     */
    public String truncate(String content, String fontName, int fontSize, double maxWidth) {
        if (measure(content, fontName, fontSize) <= maxWidth) {
            return content;
        }
        double available = maxWidth - measure(ellipsis, fontName, fontSize);
        String truncated = content;
        while (!truncated.isEmpty() && measure(truncated, fontName, fontSize) > available) {
            truncated = truncated.substring(0, truncated.length() - 1);
        }
        return truncated.stripTrailing() + ellipsis;
    }

    private WrapFit wrapToFit(TextElement text, String fontName, double maxWidth, Double maxHeight) {
        int fontSize = text.fontSize();
        List<String> lines = wrapText(text.content(), fontName, fontSize, maxWidth, text.maxLines());
        if (maxHeight == null || fontSize <= text.minFontSize() || fitsBlock(lines, fontName, fontSize, maxWidth, maxHeight)) {
            return new WrapFit(fontSize, lines);
        }

        int low = text.minFontSize();
        int high = fontSize;
        int bestSize = text.minFontSize();
        List<String> bestLines = wrapText(text.content(), fontName, bestSize, maxWidth, text.maxLines());
        while (low <= high) {
            int mid = (low + high) / 2;
            List<String> candidate = wrapText(text.content(), fontName, mid, maxWidth, text.maxLines());
            if (fitsBlock(candidate, fontName, mid, maxWidth, maxHeight)) {
                bestSize = mid;
                bestLines = candidate;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return new WrapFit(bestSize, bestLines);
    }

    private boolean fitsBlock(List<String> lines, String fontName, int fontSize, double maxWidth, double maxHeight) {
        double widest = 0.0;
        for (String line : lines) {
            widest = Math.max(widest, measure(line, fontName, fontSize));
        }
        return widest <= maxWidth && lineHeight(fontSize) * lines.size() <= maxHeight;
    }

    private double measure(String text, String fontName, int fontSize) {
        return measurer.measureTextWidth(text, fontName, fontSize);
    }

    private static String abbreviate(String content) {
        return content.length() <= 20 ? content : content.substring(0, 20) + "...";
    }

    private record WrapFit(int fontSize, List<String> lines) {
    }
}
