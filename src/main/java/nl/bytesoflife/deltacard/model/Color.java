package nl.bytesoflife.deltacard.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * RGB color with components in the range 0.0 - 1.0.
 */
public record Color(double red, double green, double blue) {

    private static final Pattern HEX = Pattern.compile("#?[0-9a-fA-F]{6}");

    public static final Color WHITE = new Color(1.0, 1.0, 1.0);
    public static final Color BLACK = new Color(0.0, 0.0, 0.0);
    public static final Color RED = new Color(0.8, 0.1, 0.1);
    public static final Color GREEN = new Color(0.2, 0.5, 0.2);
    public static final Color BLUE = new Color(0.1, 0.3, 0.7);
    public static final Color GOLD = new Color(1.0, 0.84, 0.0);
    public static final Color SILVER = new Color(0.75, 0.75, 0.75);

    public Color {
        checkComponent("red", red);
        checkComponent("green", green);
        checkComponent("blue", blue);
    }

    /**
     * Parse a {@code #RRGGBB} string. The leading '#' is optional.
     */
    public static Color fromHex(String hex) {
        if (hex == null || !HEX.matcher(hex).matches()) {
            throw new ValidationException("Hex color must be 7 characters (#RRGGBB), got: " + hex);
        }
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        int r = Integer.parseInt(digits.substring(0, 2), 16);
        int g = Integer.parseInt(digits.substring(2, 4), 16);
        int b = Integer.parseInt(digits.substring(4, 6), 16);
        return new Color(r / 255.0, g / 255.0, b / 255.0);
    }

    public static boolean isHex(String value) {
        return value != null && HEX.matcher(value).matches();
    }

    public String toHex() {
        return String.format(Locale.US, "#%02x%02x%02x",
                Math.round(red * 255), Math.round(green * 255), Math.round(blue * 255));
    }

    /**
     * Linear blend towards {@code other}; {@code t} is clamped to 0..1.
     */
    public Color interpolate(Color other, double t) {
        double p = Math.max(0.0, Math.min(1.0, t));
        return new Color(
                red + (other.red - red) * p,
                green + (other.green - green) * p,
                blue + (other.blue - blue) * p);
    }

    private static void checkComponent(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new ValidationException("Color component " + name + " must be in 0.0-1.0, got: " + value);
        }
    }

    @Override
    public String toString() {
        return toHex();
    }
}
