package nl.bytesoflife.deltacard.renderer;

import nl.bytesoflife.deltacard.model.Color;
import nl.bytesoflife.deltacard.model.Units;
import nl.bytesoflife.deltacard.text.TextFitter;
import nl.bytesoflife.deltacard.text.TextMeasurer;

/**
 * Settings shared by all renderers of one pass. Setters return {@code this} for chaining.
 */
public class RenderOptions {

    private double pointsPerInch = Units.POINTS_PER_INCH;
    private double minTileSize = 2.0;
    private String ellipsis = TextFitter.DEFAULT_ELLIPSIS;
    private int autoShrinkThreshold = TextFitter.DEFAULT_AUTO_SHRINK_THRESHOLD;
    private double lineHeightFactor = TextFitter.DEFAULT_LINE_HEIGHT_FACTOR;
    private Color defaultTextColor = Color.BLACK;
    private double foldLineWidth = 0.5;
    private Color foldLineColor = new Color(0.7, 0.7, 0.7);
    private double[] foldLineDash = {3, 3};
    private boolean drawFoldLines = true;
    private boolean clampImagesToSafeArea = true;

    public static RenderOptions defaults() {
        return new RenderOptions();
    }

    public double toPoints(double inches) {
        return inches * pointsPerInch;
    }

    public double getPointsPerInch() {
        return pointsPerInch;
    }

    public RenderOptions setPointsPerInch(double pointsPerInch) {
        if (pointsPerInch <= 0) {
            throw new IllegalArgumentException("pointsPerInch must be > 0");
        }
        this.pointsPerInch = pointsPerInch;
        return this;
    }

    public double getMinTileSize() {
        return minTileSize;
    }

    public RenderOptions setMinTileSize(double minTileSize) {
        this.minTileSize = minTileSize;
        return this;
    }

    public String getEllipsis() {
        return ellipsis;
    }

    public RenderOptions setEllipsis(String ellipsis) {
        this.ellipsis = ellipsis;
        return this;
    }

    public int getAutoShrinkThreshold() {
        return autoShrinkThreshold;
    }

    public RenderOptions setAutoShrinkThreshold(int autoShrinkThreshold) {
        this.autoShrinkThreshold = autoShrinkThreshold;
        return this;
    }

    public double getLineHeightFactor() {
        return lineHeightFactor;
    }

    public RenderOptions setLineHeightFactor(double lineHeightFactor) {
        this.lineHeightFactor = lineHeightFactor;
        return this;
    }

    public Color getDefaultTextColor() {
        return defaultTextColor;
    }

    public RenderOptions setDefaultTextColor(Color defaultTextColor) {
        this.defaultTextColor = defaultTextColor;
        return this;
    }

    public double getFoldLineWidth() {
        return foldLineWidth;
    }

    public RenderOptions setFoldLineWidth(double foldLineWidth) {
        this.foldLineWidth = foldLineWidth;
        return this;
    }

    public Color getFoldLineColor() {
        return foldLineColor;
    }

    public RenderOptions setFoldLineColor(Color foldLineColor) {
        this.foldLineColor = foldLineColor;
        return this;
    }

    public double[] getFoldLineDash() {
        return foldLineDash.clone();
    }

    public RenderOptions setFoldLineDash(double... foldLineDash) {
        this.foldLineDash = foldLineDash.clone();
        return this;
    }

    public boolean isDrawFoldLines() {
        return drawFoldLines;
    }

    public RenderOptions setDrawFoldLines(boolean drawFoldLines) {
        this.drawFoldLines = drawFoldLines;
        return this;
    }

    public boolean isClampImagesToSafeArea() {
        return clampImagesToSafeArea;
    }

    public RenderOptions setClampImagesToSafeArea(boolean clampImagesToSafeArea) {
        this.clampImagesToSafeArea = clampImagesToSafeArea;
        return this;
    }

    public TextFitter createTextFitter(TextMeasurer measurer) {
        return new TextFitter(measurer, ellipsis, autoShrinkThreshold, lineHeightFactor);
    }
}
