package nl.bytesoflife.deltacard.text;

import nl.bytesoflife.deltacard.model.FontStyle;

import java.util.Locale;
import java.util.Map;

/**
 * Maps a font family and style onto one of the standard PostScript font names.
 * Unknown families are passed through with a style suffix.
 */
public final class FontNames {

    private static final String HELVETICA = "Helvetica";
    private static final String TIMES = "Times-Roman";
    private static final String COURIER = "Courier";

    private static final Map<String, String> FAMILIES = Map.of(
            "helvetica", HELVETICA,
            "times", TIMES,
            "courier", COURIER);

    private FontNames() {
    }

    public static String resolve(String family, FontStyle style) {
        String base = FAMILIES.getOrDefault(family.toLowerCase(Locale.ROOT), family);
        if (style == null) {
            return base;
        }
        return switch (style) {
            case BOLD -> base.equals(TIMES) ? "Times-Bold" : base + "-Bold";
            case ITALIC -> {
                if (base.equals(TIMES)) {
                    yield "Times-Italic";
                }
                yield isOblique(base) ? base + "-Oblique" : base + "-Italic";
            }
            case BOLD_ITALIC -> {
                if (base.equals(TIMES)) {
                    yield "Times-BoldItalic";
                }
                yield isOblique(base) ? base + "-BoldOblique" : base + "-BoldItalic";
            }
            case NORMAL -> base;
        };
    }

    // Sans and monospace standard fonts name their slanted variants "Oblique"
    private static boolean isOblique(String base) {
        return base.equals(HELVETICA) || base.equals(COURIER);
    }
}
