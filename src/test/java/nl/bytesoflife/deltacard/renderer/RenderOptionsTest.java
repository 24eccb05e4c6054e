package nl.bytesoflife.deltacard.renderer;

import nl.bytesoflife.deltacard.model.OverflowPolicy;
import nl.bytesoflife.deltacard.model.TextElement;
import nl.bytesoflife.deltacard.text.FitResult;
import nl.bytesoflife.deltacard.text.TextFitter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RenderOptionsTest {

    @Test
    void defaultsToPostScriptPoints() {
        RenderOptions options = RenderOptions.defaults();

        assertEquals(72.0, options.toPoints(1.0), 1e-9);
        assertTrue(options.isDrawFoldLines());
        assertTrue(options.isClampImagesToSafeArea());
        assertArrayEquals(new double[]{3, 3}, options.getFoldLineDash());
    }

    @Test
    void rejectsNonPositiveResolution() {
        assertThrows(IllegalArgumentException.class, () -> RenderOptions.defaults().setPointsPerInch(0));
        assertEquals(144.0, RenderOptions.defaults().setPointsPerInch(96).toPoints(1.5), 1e-9);
    }

    @Test
    void fitterUsesConfiguredEllipsis() {
        TextFitter fitter = RenderOptions.defaults().setEllipsis("~").setLineHeightFactor(1.5)
                .createTextFitter((text, font, size) -> text.length() * size * 0.5);

        assertEquals(18.0, fitter.lineHeight(12), 1e-9);
        FitResult result = fitter.fit(TextElement.builder("Hello World")
                .overflow(OverflowPolicy.TRUNCATE).fontSize(10).build(),
                "Helvetica", 40, null);
        assertEquals("Hello W~", result.lines().get(0));
    }
}
