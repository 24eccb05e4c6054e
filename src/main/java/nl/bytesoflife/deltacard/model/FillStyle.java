package nl.bytesoflife.deltacard.model;

import java.util.List;

/**
 * Paint applied to a shape's interior. The {@link #type()} string is the discriminator used
 * in scene descriptions.
 */
public sealed interface FillStyle
        permits FillStyle.Solid, FillStyle.LinearGradient, FillStyle.RadialGradient, FillStyle.Pattern {

    int MIN_STOPS = 2;
    int MAX_STOPS = 20;
    int MAX_PATTERN_COLORS = 4;

    String type();

    /**
     * Color used when the fill cannot be painted natively.
     */
    Color fallbackColor();

    record Solid(Color color) implements FillStyle {
        public Solid {
            Checks.required("color", color);
        }

        @Override
        public String type() {
            return "solid";
        }

        @Override
        public Color fallbackColor() {
            return color;
        }
    }

    record LinearGradient(double angle, List<ColorStop> stops) implements FillStyle {
        public LinearGradient {
            Checks.inHalfOpenRange("angle", angle, 0.0, 360.0);
            stops = checkStops(stops);
        }

        @Override
        public String type() {
            return "linear_gradient";
        }

        @Override
        public Color fallbackColor() {
            return stops.get(0).color();
        }
    }

    record RadialGradient(double centerX, double centerY, double radius, List<ColorStop> stops)
            implements FillStyle {
        public RadialGradient {
            Checks.inRange("center_x", centerX, 0.0, 1.0);
            Checks.inRange("center_y", centerY, 0.0, 1.0);
            if (!(radius > 0.0 && radius <= 1.0)) {
                throw new ValidationException("radius must be in (0.0, 1.0], got: " + radius);
            }
            stops = checkStops(stops);
        }

        public static RadialGradient centered(List<ColorStop> stops) {
            return new RadialGradient(0.5, 0.5, 0.5, stops);
        }

        @Override
        public String type() {
            return "radial_gradient";
        }

        @Override
        public Color fallbackColor() {
            return stops.get(0).color();
        }
    }

    record Pattern(PatternKind kind, List<Color> colors, double spacing, double scale, double rotation)
            implements FillStyle {
        public static final double DEFAULT_SPACING = 0.25;

        public Pattern {
            Checks.required("pattern_type", kind);
            if (colors == null || colors.isEmpty()) {
                throw new ValidationException("Pattern must have at least 1 color");
            }
            if (colors.size() > MAX_PATTERN_COLORS) {
                throw new ValidationException("Pattern cannot have more than " + MAX_PATTERN_COLORS
                        + " colors, got: " + colors.size());
            }
            Checks.noNullElements("colors", colors);
            colors = List.copyOf(colors);
            if (!(spacing > 0.0 && spacing <= 2.0)) {
                throw new ValidationException("Pattern spacing " + spacing + " out of range (0.0-2.0]");
            }
            if (!(scale > 0.0 && scale <= 5.0)) {
                throw new ValidationException("Pattern scale " + scale + " out of range (0.0-5.0]");
            }
            Checks.inHalfOpenRange("rotation", rotation, 0.0, 360.0);
        }

        public Pattern(PatternKind kind, List<Color> colors) {
            this(kind, colors, DEFAULT_SPACING, 1.0, 0.0);
        }

        @Override
        public String type() {
            return "pattern";
        }

        @Override
        public Color fallbackColor() {
            return colors.get(0);
        }
    }

    private static List<ColorStop> checkStops(List<ColorStop> stops) {
        if (stops == null || stops.size() < MIN_STOPS) {
            throw new ValidationException("Gradient must have at least " + MIN_STOPS + " color stops");
        }
        if (stops.size() > MAX_STOPS) {
            throw new ValidationException("Gradient cannot have more than " + MAX_STOPS + " color stops");
        }
        Checks.noNullElements("stops", stops);
        for (int i = 1; i < stops.size(); i++) {
            if (stops.get(i).position() < stops.get(i - 1).position()) {
                throw new ValidationException("Color stops must be in ascending position order");
            }
        }
        return List.copyOf(stops);
    }
}
