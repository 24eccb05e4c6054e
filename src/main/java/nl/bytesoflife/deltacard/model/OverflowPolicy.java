package nl.bytesoflife.deltacard.model;

/**
 * How text that is wider than its box is brought back inside it.
 */
public enum OverflowPolicy {
    AUTO("auto"),
    SHRINK("shrink"),
    WRAP("wrap"),
    TRUNCATE("truncate");

    private final String key;

    OverflowPolicy(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static OverflowPolicy fromKey(String key) {
        for (OverflowPolicy value : values()) {
            if (value.key.equalsIgnoreCase(key)) {
                return value;
            }
        }
        throw new ValidationException("Unknown OverflowPolicy value: " + key);
    }
}
