package nl.bytesoflife.deltacard.text;

import nl.bytesoflife.deltacard.model.OverflowPolicy;

/**
 * What the fitter did to a text element: the policy that ran, the size change, the number of
 * lines produced and whether characters were dropped.
 */
public record AdjustmentResult(boolean wasAdjusted, OverflowPolicy policyApplied, int originalFontSize,
                               int finalFontSize, int linesUsed, boolean contentTruncated) {

    @Override
    public String toString() {
        return policyApplied.getKey() + " " + originalFontSize + "pt -> " + finalFontSize + "pt, "
                + linesUsed + (linesUsed == 1 ? " line" : " lines")
                + (contentTruncated ? ", truncated" : "");
    }
}
