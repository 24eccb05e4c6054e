package nl.bytesoflife.deltacard.model;

public enum FontStyle {
    NORMAL("normal"),
    BOLD("bold"),
    ITALIC("italic"),
    BOLD_ITALIC("bold_italic");

    private final String key;

    FontStyle(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static FontStyle fromKey(String key) {
        for (FontStyle value : values()) {
            if (value.key.equalsIgnoreCase(key)) {
                return value;
            }
        }
        throw new ValidationException("Unknown FontStyle value: " + key);
    }
}
