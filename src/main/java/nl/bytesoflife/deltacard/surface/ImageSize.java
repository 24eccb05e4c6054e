package nl.bytesoflife.deltacard.surface;

/**
 * Natural size of an image in inches (pixel size divided by its resolution).
 */
public record ImageSize(double width, double height) {

    public ImageSize {
        if (!(width > 0) || !(height > 0)) {
            throw new IllegalArgumentException("Image size must be positive: " + width + "x" + height);
        }
    }

    public static ImageSize fromPixels(int widthPx, int heightPx, double dpiX, double dpiY) {
        return new ImageSize(widthPx / dpiX, heightPx / dpiY);
    }

    public double aspectRatio() {
        return width / height;
    }
}
