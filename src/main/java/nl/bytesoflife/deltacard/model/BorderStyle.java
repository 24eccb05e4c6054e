package nl.bytesoflife.deltacard.model;

/**
 * Line style of a panel border. The dash array is on/off lengths in points; empty means solid.
 */
public enum BorderStyle {
    SOLID("solid"),
    DASHED("dashed", 6, 3),
    DOTTED("dotted", 1, 2),
    DECORATIVE("decorative", 8, 2, 2, 2);

    private final String key;
    private final double[] dashArray;

    BorderStyle(String key, double... dashArray) {
        this.key = key;
        this.dashArray = dashArray;
    }

    public String getKey() {
        return key;
    }

    public double[] getDashArray() {
        return dashArray.clone();
    }

    public static BorderStyle fromKey(String key) {
        for (BorderStyle style : values()) {
            if (style.key.equalsIgnoreCase(key)) {
                return style;
            }
        }
        throw new ValidationException("Unknown border style: " + key);
    }
}
