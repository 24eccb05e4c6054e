package nl.bytesoflife.deltacard.decorative;

import nl.bytesoflife.deltacard.model.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A reusable composite of primitive shapes. Child shapes are kept as key-value descriptions
 * whose {@code fill_color} and {@code stroke_color} may name a color role as {@code {role}}.
 * Child coordinates are inches relative to the composite's anchor at scale 1.
 */
public record DecorativeDefinition(String name, String description, double defaultWidth, double defaultHeight,
                                   Map<String, String> colorRoles, List<Map<String, Object>> shapes) {

    public DecorativeDefinition {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Decorative definition name is required");
        }
        if (!(defaultWidth > 0) || !(defaultHeight > 0)) {
            throw new ValidationException("Decorative definition '" + name + "' needs a positive default size");
        }
        description = description == null ? "" : description;
        colorRoles = colorRoles == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(colorRoles));
        List<Map<String, Object>> children = new ArrayList<>();
        if (shapes != null) {
            for (Map<String, Object> shape : shapes) {
                children.add(Collections.unmodifiableMap(new LinkedHashMap<>(shape)));
            }
        }
        shapes = Collections.unmodifiableList(children);
    }

    /**
     * Build a definition from its key-value description ({@code name}, {@code description},
     * {@code default_width}, {@code default_height}, {@code color_roles}, {@code shapes}).
     */
    @SuppressWarnings("unchecked")
    public static DecorativeDefinition fromMap(Map<String, Object> map) {
        Object roles = map.get("color_roles");
        Object shapes = map.get("shapes");
        if (roles != null && !(roles instanceof Map)) {
            throw new ValidationException("color_roles must be a mapping");
        }
        if (shapes != null && !(shapes instanceof List)) {
            throw new ValidationException("shapes must be a list");
        }
        Map<String, String> colorRoles = new LinkedHashMap<>();
        if (roles != null) {
            ((Map<Object, Object>) roles).forEach((k, v) -> colorRoles.put(String.valueOf(k), String.valueOf(v)));
        }
        return new DecorativeDefinition(
                map.get("name") == null ? null : String.valueOf(map.get("name")),
                map.get("description") == null ? null : String.valueOf(map.get("description")),
                toDouble(map.get("default_width"), "default_width"),
                toDouble(map.get("default_height"), "default_height"),
                colorRoles,
                (List<Map<String, Object>>) shapes);
    }

    private static double toDouble(Object value, String key) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new ValidationException("Field '" + key + "' must be a number, got: " + value);
    }
}
