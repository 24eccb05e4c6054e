package nl.bytesoflife.deltacard.model;

import java.util.Map;
import java.util.UUID;

/**
 * Vector element placed on a panel. All coordinates are inches relative to the panel's
 * lower-left corner.
 */
public sealed interface Shape permits Shape.Primitive, Shape.DecorativeRef {

    String id();

    int zIndex();

    /**
     * Discriminator used in scene descriptions.
     */
    String type();

    /**
     * A shape that is drawn directly, as opposed to a reference to a decorative composite.
     */
    sealed interface Primitive extends Shape
            permits Rectangle, Circle, Triangle, Star, Line, Path {

        ShapeStyle style();

        @Override
        default String id() {
            return style().id();
        }

        @Override
        default int zIndex() {
            return style().zIndex();
        }
    }

    record Rectangle(ShapeStyle style, double x, double y, double width, double height) implements Primitive {
        public Rectangle {
            Checks.required("style", style);
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

    record Circle(ShapeStyle style, double centerX, double centerY, double radius) implements Primitive {
        public Circle {
            Checks.required("style", style);
            Checks.nonNegative("center_x", centerX);
            Checks.nonNegative("center_y", centerY);
            Checks.positive("radius", radius);
        }

        @Override
        public String type() {
            return "circle";
        }
    }

    record Triangle(ShapeStyle style, Point p1, Point p2, Point p3) implements Primitive {
        public Triangle {
            Checks.required("style", style);
            Checks.required("vertex 1", p1);
            Checks.required("vertex 2", p2);
            Checks.required("vertex 3", p3);
        }

        @Override
        public String type() {
            return "triangle";
        }
    }

    record Star(ShapeStyle style, double centerX, double centerY, double outerRadius, double innerRadius,
                int points) implements Primitive {
        public Star {
            Checks.required("style", style);
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

    record Line(ShapeStyle style, Point start, Point end) implements Primitive {
        public Line {
            Checks.required("style", style);
            Checks.required("start", start);
            Checks.required("end", end);
        }

        @Override
        public String type() {
            return "line";
        }
    }

    record Path(ShapeStyle style, String pathData, double scale) implements Primitive {
        private static final String COMMAND_LETTERS = "MmLlHhVvCcSsQqTtAaZz";

        public Path {
            Checks.required("style", style);
            if (pathData == null || pathData.isBlank()) {
                throw new ValidationException("SVG path data cannot be empty");
            }
            pathData = pathData.strip();
            if (pathData.chars().noneMatch(c -> COMMAND_LETTERS.indexOf(c) >= 0)) {
                throw new ValidationException("SVG path must contain at least one valid command: " + pathData);
            }
            if (!(scale > 0.0 && scale <= 10.0)) {
                throw new ValidationException("Path scale " + scale + " out of range (0.0-10.0]");
            }
        }

        @Override
        public String type() {
            return "svg_path";
        }
    }

    /**
     * Instance of a named decorative composite. {@code palette} maps color roles to
     * {@code #RRGGBB} overrides.
     */
    record DecorativeRef(String id, String name, double x, double y, double scale, double rotation,
                         Map<String, String> palette, int zIndex) implements Shape {
        public DecorativeRef {
            if (id == null || id.isEmpty()) {
                id = UUID.randomUUID().toString();
            }
            if (name == null || name.isBlank()) {
                throw new ValidationException("Decorative element name is required");
            }
            Checks.nonNegative("x", x);
            Checks.nonNegative("y", y);
            Checks.positive("scale", scale);
            Checks.inHalfOpenRange("rotation", rotation, 0.0, 360.0);
            palette = palette == null ? Map.of() : Map.copyOf(palette);
            for (Map.Entry<String, String> entry : palette.entrySet()) {
                if (!Color.isHex(entry.getValue())) {
                    throw new ValidationException("Palette color for role '" + entry.getKey()
                            + "' is not a hex color: " + entry.getValue());
                }
            }
        }

        public DecorativeRef(String name, double x, double y) {
            this(null, name, x, y, 1.0, 0.0, Map.of(), 0);
        }

        @Override
        public String type() {
            return "decorative_element";
        }
    }
}
