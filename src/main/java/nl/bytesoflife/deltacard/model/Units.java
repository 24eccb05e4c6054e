package nl.bytesoflife.deltacard.model;

/**
 * Page geometry constants and inch/point conversion.
 * Scene coordinates are inches; the drawing surface works in points (72 per inch).
 */
public final class Units {

    public static final double POINTS_PER_INCH = 72.0;

    // US Letter
    public static final double PAGE_WIDTH = 8.5;
    public static final double PAGE_HEIGHT = 11.0;

    public static final double SAFE_MARGIN = 0.25;

    public static final int MIN_DPI = 150;
    public static final int RECOMMENDED_DPI = 300;

    private Units() {
    }

    public static double inchesToPoints(double inches) {
        return inches * POINTS_PER_INCH;
    }

    public static double pointsToInches(double points) {
        return points / POINTS_PER_INCH;
    }

    /**
     * Whether a rectangle (inches, page-relative) stays inside the page's safe area.
     */
    public static boolean isWithinPage(double x, double y, double width, double height) {
        return isWithinPanel(x, y, width, height, PAGE_WIDTH, PAGE_HEIGHT);
    }

    /**
     * Whether a rectangle (inches, panel-relative) stays inside the panel's safe area.
     */
    public static boolean isWithinPanel(double x, double y, double width, double height,
                                        double panelWidth, double panelHeight) {
        if (x < SAFE_MARGIN || y < SAFE_MARGIN) {
            return false;
        }
        if (x + width > panelWidth - SAFE_MARGIN) {
            return false;
        }
        return y + height <= panelHeight - SAFE_MARGIN;
    }
}
