package nl.bytesoflife.deltacard.model;

import java.util.UUID;

/**
 * Attributes shared by all primitive shapes. {@code fill} takes precedence over the
 * single {@code fillColor}; with neither set the shape is stroke-only.
 */
public record ShapeStyle(String id, int zIndex, double opacity, double rotation,
                         Color strokeColor, double strokeWidth, FillStyle fill, Color fillColor) {

    public ShapeStyle {
        if (id == null || id.isEmpty()) {
            id = UUID.randomUUID().toString();
        }
        Checks.inRange("opacity", opacity, 0.0, 1.0);
        Checks.inHalfOpenRange("rotation", rotation, 0.0, 360.0);
        Checks.nonNegative("stroke_width", strokeWidth);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Paint to use for the interior, or null for stroke-only.
     */
    public FillStyle effectiveFill() {
        if (fill != null) {
            return fill;
        }
        return fillColor != null ? new FillStyle.Solid(fillColor) : null;
    }

    public boolean hasStroke() {
        return strokeColor != null && strokeWidth > 0;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .zIndex(zIndex)
                .opacity(opacity)
                .rotation(rotation)
                .strokeColor(strokeColor)
                .strokeWidth(strokeWidth)
                .fill(fill)
                .fillColor(fillColor);
    }

    public static class Builder {
        private String id;
        private int zIndex = 0;
        private double opacity = 1.0;
        private double rotation = 0.0;
        private Color strokeColor;
        private double strokeWidth = 0.0;
        private FillStyle fill;
        private Color fillColor;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder zIndex(int zIndex) {
            this.zIndex = zIndex;
            return this;
        }

        public Builder opacity(double opacity) {
            this.opacity = opacity;
            return this;
        }

        public Builder rotation(double rotation) {
            this.rotation = rotation;
            return this;
        }

        public Builder strokeColor(Color strokeColor) {
            this.strokeColor = strokeColor;
            return this;
        }

        public Builder stroke(Color color, double width) {
            this.strokeColor = color;
            this.strokeWidth = width;
            return this;
        }

        public Builder strokeWidth(double strokeWidth) {
            this.strokeWidth = strokeWidth;
            return this;
        }

        public Builder fill(FillStyle fill) {
            this.fill = fill;
            return this;
        }

        public Builder fillColor(Color fillColor) {
            this.fillColor = fillColor;
            return this;
        }

        public ShapeStyle build() {
            return new ShapeStyle(id, zIndex, opacity, rotation, strokeColor, strokeWidth, fill, fillColor);
        }
    }
}
