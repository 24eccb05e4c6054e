package nl.bytesoflife.deltacard.model;

public enum PanelPosition {
    FRONT("front"),
    BACK("back"),
    INSIDE_LEFT("inside_left"),
    INSIDE_RIGHT("inside_right"),
    CENTER("center");

    private final String key;

    PanelPosition(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static PanelPosition fromKey(String key) {
        for (PanelPosition value : values()) {
            if (value.key.equalsIgnoreCase(key)) {
                return value;
            }
        }
        throw new ValidationException("Unknown PanelPosition value: " + key);
    }
}
