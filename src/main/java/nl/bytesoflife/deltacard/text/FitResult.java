package nl.bytesoflife.deltacard.text;

import java.util.List;

public record FitResult(int fontSize, List<String> lines, AdjustmentResult adjustment) {

    public FitResult {
        lines = List.copyOf(lines);
    }
}
