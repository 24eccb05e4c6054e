package nl.bytesoflife.deltacard.model;

/**
 * Region restricting where an image is visible. Coordinates are inches relative to the
 * image's lower-left corner.
 */
public sealed interface ClipMask
        permits ClipMask.Circle, ClipMask.Rectangle, ClipMask.Ellipse, ClipMask.Star, ClipMask.Path {

    String type();

    record Circle(double centerX, double centerY, double radius) implements ClipMask {
        public Circle {
            Checks.nonNegative("center_x", centerX);
            Checks.nonNegative("center_y", centerY);
            Checks.positive("radius", radius);
        }

        @Override
        public String type() {
            return "circle";
        }
    }

    record Rectangle(double x, double y, double width, double height) implements ClipMask {
        public Rectangle {
            Checks.nonNegative("x", x);
            Checks.nonNegative("y", y);
            Checks.positive("width", width);
            Checks.positive("height", height);
        }

        @Override
        public String type() {
            return "rectangle";
        }
    }

    record Ellipse(double centerX, double centerY, double radiusX, double radiusY) implements ClipMask {
        public Ellipse {
            Checks.nonNegative("center_x", centerX);
            Checks.nonNegative("center_y", centerY);
            Checks.positive("radius_x", radiusX);
            Checks.positive("radius_y", radiusY);
        }

        @Override
        public String type() {
            return "ellipse";
        }
    }

    record Star(double centerX, double centerY, double outerRadius, double innerRadius, int points)
            implements ClipMask {
        public Star {
            Checks.nonNegative("center_x", centerX);
            Checks.nonNegative("center_y", centerY);
            Checks.positive("outer_radius", outerRadius);
            Checks.positive("inner_radius", innerRadius);
            if (innerRadius >= outerRadius) {
                throw new ValidationException("inner_radius (" + innerRadius
                        + ") must be smaller than outer_radius (" + outerRadius + ")");
            }
            Checks.inRange("points", points, 3, 20);
        }

        @Override
        public String type() {
            return "star";
        }
    }

    record Path(String pathData, double scale) implements ClipMask {
        public Path {
            if (pathData == null || pathData.isBlank()) {
                throw new ValidationException("Clip path data cannot be empty");
            }
            pathData = pathData.strip();
            if (!pathData.endsWith("Z") && !pathData.endsWith("z")) {
                throw new ValidationException("Clip path must be closed (end with Z or z): " + pathData);
            }
            if (!(scale > 0.0 && scale <= 10.0)) {
                throw new ValidationException("Clip path scale " + scale + " out of range (0.0-10.0]");
            }
        }

        public Path(String pathData) {
            this(pathData, 1.0);
        }

        @Override
        public String type() {
            return "svg_path";
        }
    }
}
