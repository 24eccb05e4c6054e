package nl.bytesoflife.deltacard.model;

/**
 * How the US Letter sheet is folded. Panel sizes are the folded face size in inches.
 */
public enum FoldType {
    /** Single horizontal fold, 5.5 x 8.5 faces. */
    HALF_FOLD("half_fold", Units.PAGE_HEIGHT / 2, Units.PAGE_WIDTH),
    /** Horizontal and vertical fold, 4.25 x 5.5 faces. */
    QUARTER_FOLD("quarter_fold", Units.PAGE_WIDTH / 2, Units.PAGE_HEIGHT / 2),
    /** Two vertical folds dividing the page into thirds. */
    TRI_FOLD("tri_fold", Units.PAGE_WIDTH / 3, Units.PAGE_HEIGHT);

    private final String key;
    private final double panelWidth;
    private final double panelHeight;

    FoldType(String key, double panelWidth, double panelHeight) {
        this.key = key;
        this.panelWidth = panelWidth;
        this.panelHeight = panelHeight;
    }

    public String getKey() {
        return key;
    }

    public double getPanelWidth() {
        return panelWidth;
    }

    public double getPanelHeight() {
        return panelHeight;
    }

    public static FoldType fromKey(String key) {
        for (FoldType type : values()) {
            if (type.key.equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new ValidationException("Unknown fold type: " + key);
    }
}
