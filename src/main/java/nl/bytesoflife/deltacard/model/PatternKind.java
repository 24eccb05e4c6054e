package nl.bytesoflife.deltacard.model;

/**
 * Repeat unit of a pattern fill.
 */
public enum PatternKind {
    STRIPES("stripes"),
    DOTS("dots"),
    GRID("grid"),
    CHECKERBOARD("checkerboard");

    private final String key;

    PatternKind(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static PatternKind fromKey(String key) {
        for (PatternKind kind : values()) {
            if (kind.key.equalsIgnoreCase(key)) {
                return kind;
            }
        }
        throw new ValidationException("Unknown pattern type: " + key);
    }
}
