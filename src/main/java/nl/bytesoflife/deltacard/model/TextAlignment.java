package nl.bytesoflife.deltacard.model;

/**
 * Horizontal alignment of text lines relative to the anchor x.
 */
public enum TextAlignment {
    LEFT("left"),
    CENTER("center"),
    RIGHT("right");

    private final String key;

    TextAlignment(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static TextAlignment fromKey(String key) {
        for (TextAlignment value : values()) {
            if (value.key.equalsIgnoreCase(key)) {
                return value;
            }
        }
        throw new ValidationException("Unknown TextAlignment value: " + key);
    }
}
