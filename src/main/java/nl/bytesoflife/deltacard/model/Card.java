package nl.bytesoflife.deltacard.model;

import java.util.List;

/**
 * One printable card: a fold type plus its panels, drawn in list order.
 */
public record Card(String name, FoldType foldType, List<Panel> panels) {

    public Card {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Card name is required");
        }
        if (name.length() > 100) {
            throw new ValidationException("Card name exceeds 100 characters");
        }
        Checks.required("fold_type", foldType);
        if (panels == null || panels.isEmpty()) {
            throw new ValidationException("Card must have at least one panel");
        }
        panels = List.copyOf(panels);
    }
}
