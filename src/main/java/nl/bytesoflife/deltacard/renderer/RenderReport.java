package nl.bytesoflife.deltacard.renderer;

import nl.bytesoflife.deltacard.text.AdjustmentResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-element outcomes and text adjustments collected during one card render.
 */
public class RenderReport {

    private final List<ElementOutcome> outcomes = new ArrayList<>();
    private final Map<String, AdjustmentResult> textAdjustments = new LinkedHashMap<>();

    public void addOutcome(ElementOutcome outcome) {
        outcomes.add(outcome);
    }

    public void addTextAdjustment(String textId, AdjustmentResult adjustment) {
        textAdjustments.put(textId, adjustment);
    }

    public List<ElementOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public List<ElementOutcome> getDegraded() {
        return outcomes.stream()
                .filter(o -> o.status() == ElementOutcome.Status.DEGRADED)
                .toList();
    }

    public List<ElementOutcome> getSkipped() {
        return outcomes.stream()
                .filter(o -> o.status() == ElementOutcome.Status.SKIPPED)
                .toList();
    }

    public int getRenderedCount() {
        return (int) outcomes.stream().filter(ElementOutcome::isRendered).count();
    }

    public boolean isClean() {
        return outcomes.stream().allMatch(ElementOutcome::isRendered);
    }

    public Map<String, AdjustmentResult> getTextAdjustments() {
        return Collections.unmodifiableMap(textAdjustments);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Render Report:\n");
        sb.append("  Elements: ").append(outcomes.size())
          .append(" (").append(getRenderedCount()).append(" rendered, ")
          .append(getDegraded().size()).append(" degraded, ")
          .append(getSkipped().size()).append(" skipped)\n");
        for (ElementOutcome o : outcomes) {
            if (!o.isRendered()) {
                sb.append("  - ").append(o).append("\n");
            }
        }
        if (!textAdjustments.isEmpty()) {
            sb.append("  Text adjustments:\n");
            for (Map.Entry<String, AdjustmentResult> e : textAdjustments.entrySet()) {
                sb.append("  - ").append(e.getKey()).append(": ").append(e.getValue()).append("\n");
            }
        }
        return sb.toString();
    }
}
