package nl.bytesoflife.deltacard.model;

import java.util.UUID;

/**
 * A run of text anchored at (x, y) in panel inches. When {@code width} is set the text is
 * fitted into it according to the overflow policy; {@code maxLines} is null for unlimited.
 */
public record TextElement(String id, String content, double x, double y, Double width,
                          String fontFamily, int fontSize, FontStyle fontStyle, Color color,
                          TextAlignment alignment, double rotation, int zIndex,
                          OverflowPolicy overflowPolicy, Integer maxLines, int minFontSize) {

    public static final int MAX_CONTENT_LENGTH = 1000;

    public TextElement {
        if (id == null || id.isEmpty()) {
            id = UUID.randomUUID().toString();
        }
        if (content == null || content.isEmpty()) {
            throw new ValidationException("Text content cannot be empty");
        }
        if (content.length() > MAX_CONTENT_LENGTH) {
            throw new ValidationException("Text content exceeds " + MAX_CONTENT_LENGTH
                    + " characters: " + content.length());
        }
        Checks.nonNegative("x", x);
        Checks.nonNegative("y", y);
        if (width != null) {
            Checks.nonNegative("width", width);
        }
        if (fontFamily == null || fontFamily.isBlank()) {
            fontFamily = "Helvetica";
        }
        Checks.inRange("font_size", fontSize, 6, 144);
        fontStyle = fontStyle == null ? FontStyle.NORMAL : fontStyle;
        alignment = alignment == null ? TextAlignment.LEFT : alignment;
        Checks.finite("rotation", rotation);
        overflowPolicy = overflowPolicy == null ? OverflowPolicy.AUTO : overflowPolicy;
        if (maxLines != null && maxLines < 1) {
            throw new ValidationException("max_lines must be >= 1, got: " + maxLines);
        }
        Checks.inRange("min_font_size", minFontSize, 6, 72);
    }

    public static Builder builder(String content) {
        return new Builder(content);
    }

    public boolean hasWidth() {
        return width != null && width > 0;
    }

    public static class Builder {
        private String id;
        private final String content;
        private double x;
        private double y;
        private Double width;
        private String fontFamily = "Helvetica";
        private int fontSize = 12;
        private FontStyle fontStyle = FontStyle.NORMAL;
        private Color color;
        private TextAlignment alignment = TextAlignment.LEFT;
        private double rotation;
        private int zIndex = 100;
        private OverflowPolicy overflowPolicy = OverflowPolicy.AUTO;
        private Integer maxLines;
        private int minFontSize = 8;

        private Builder(String content) {
            this.content = content;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder at(double x, double y) {
            this.x = x;
            this.y = y;
            return this;
        }

        public Builder width(Double width) {
            this.width = width;
            return this;
        }

        public Builder font(String family, int size, FontStyle style) {
            this.fontFamily = family;
            this.fontSize = size;
            this.fontStyle = style;
            return this;
        }

        public Builder fontSize(int fontSize) {
            this.fontSize = fontSize;
            return this;
        }

        public Builder color(Color color) {
            this.color = color;
            return this;
        }

        public Builder alignment(TextAlignment alignment) {
            this.alignment = alignment;
            return this;
        }

        public Builder rotation(double rotation) {
            this.rotation = rotation;
            return this;
        }

        public Builder zIndex(int zIndex) {
            this.zIndex = zIndex;
            return this;
        }

        public Builder overflow(OverflowPolicy policy) {
            this.overflowPolicy = policy;
            return this;
        }

        public Builder maxLines(Integer maxLines) {
            this.maxLines = maxLines;
            return this;
        }

        public Builder minFontSize(int minFontSize) {
            this.minFontSize = minFontSize;
            return this;
        }

        public TextElement build() {
            return new TextElement(id, content, x, y, width, fontFamily, fontSize, fontStyle, color,
                    alignment, rotation, zIndex, overflowPolicy, maxLines, minFontSize);
        }
    }
}
