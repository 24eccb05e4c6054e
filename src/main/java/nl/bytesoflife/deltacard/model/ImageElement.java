package nl.bytesoflife.deltacard.model;

import java.util.UUID;

/**
 * Raster image placed on a panel. Width and height are optional; missing values are derived
 * from the image's natural size.
 */
public record ImageElement(String id, String sourcePath, double x, double y, Double width, Double height,
                           boolean preserveAspect, double rotation, double opacity, int zIndex,
                           ClipMask clipMask) {

    public ImageElement {
        if (id == null || id.isEmpty()) {
            id = UUID.randomUUID().toString();
        }
        if (sourcePath == null || sourcePath.isBlank()) {
            throw new ValidationException("Image source_path is required");
        }
        Checks.nonNegative("x", x);
        Checks.nonNegative("y", y);
        if (width != null) {
            Checks.nonNegative("width", width);
        }
        if (height != null) {
            Checks.nonNegative("height", height);
        }
        Checks.finite("rotation", rotation);
        Checks.inRange("opacity", opacity, 0.0, 1.0);
    }

    public static Builder builder(String sourcePath) {
        return new Builder(sourcePath);
    }

    public static class Builder {
        private String id;
        private final String sourcePath;
        private double x;
        private double y;
        private Double width;
        private Double height;
        private boolean preserveAspect = true;
        private double rotation;
        private double opacity = 1.0;
        private int zIndex = 100;
        private ClipMask clipMask;

        private Builder(String sourcePath) {
            this.sourcePath = sourcePath;
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

        public Builder size(Double width, Double height) {
            this.width = width;
            this.height = height;
            return this;
        }

        public Builder preserveAspect(boolean preserveAspect) {
            this.preserveAspect = preserveAspect;
            return this;
        }

        public Builder rotation(double rotation) {
            this.rotation = rotation;
            return this;
        }

        public Builder opacity(double opacity) {
            this.opacity = opacity;
            return this;
        }

        public Builder zIndex(int zIndex) {
            this.zIndex = zIndex;
            return this;
        }

        public Builder clipMask(ClipMask clipMask) {
            this.clipMask = clipMask;
            return this;
        }

        public ImageElement build() {
            return new ImageElement(id, sourcePath, x, y, width, height, preserveAspect, rotation,
                    opacity, zIndex, clipMask);
        }
    }
}
