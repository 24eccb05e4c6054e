package nl.bytesoflife.deltacard.decorative;

import nl.bytesoflife.deltacard.model.Shape;
import nl.bytesoflife.deltacard.model.ValidationException;
import nl.bytesoflife.deltacard.parser.SceneElementParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands a decorative reference into primitive shapes: palette substitution, then scale and
 * anchor offset, then rotation and layer propagation.
 */
public class DecorativeExpander {

    private static final Logger log = LoggerFactory.getLogger(DecorativeExpander.class);

    private static final Map<String, String[]> POSITION_FIELDS = Map.of(
            "rectangle", new String[]{"x", "y"},
            "circle", new String[]{"center_x", "center_y"},
            "star", new String[]{"center_x", "center_y"},
            "triangle", new String[]{"x1", "y1", "x2", "y2", "x3", "y3"},
            "line", new String[]{"start_x", "start_y", "end_x", "end_y"});

    private static final Map<String, String[]> SIZE_FIELDS = Map.of(
            "rectangle", new String[]{"width", "height"},
            "circle", new String[]{"radius"},
            "star", new String[]{"outer_radius", "inner_radius"});

    private final DecorativeLibrary library;
    private final SceneElementParser parser;

    public DecorativeExpander(DecorativeLibrary library) {
        this(library, new SceneElementParser());
    }

    public DecorativeExpander(DecorativeLibrary library, SceneElementParser parser) {
        this.library = library;
        this.parser = parser;
    }

    /**
     * Shapes produced by one expansion, plus a message for every child that was dropped.
     */
    public record Expansion(List<Shape.Primitive> shapes, List<String> skipped) {
        public Expansion {
            shapes = List.copyOf(shapes);
            skipped = List.copyOf(skipped);
        }
    }

    /**
     * @throws nl.bytesoflife.deltacard.renderer.RenderException if the definition is unknown
     */
    public Expansion expand(Shape.DecorativeRef ref) {
        DecorativeDefinition definition = library.get(ref.name());
        List<Map<String, Object>> children = applyTransforms(resolveColors(definition, ref.palette()), ref);

        List<Shape.Primitive> shapes = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            Map<String, Object> child = children.get(i);
            try {
                Shape shape = parser.parseShape(child);
                if (shape instanceof Shape.Primitive primitive) {
                    shapes.add(primitive);
                } else {
                    throw new ValidationException("nested decorative elements are not supported");
                }
            } catch (ValidationException e) {
                String message = ref.name() + " child " + i + " (" + child.get("type") + "): " + e.getMessage();
                log.warn("Skipping decorative child {}", message);
                skipped.add(message);
            }
        }
        log.debug("Expanded decorative '{}' into {} shapes", ref.name(), shapes.size());
        return new Expansion(shapes, skipped);
    }

    /**
     * Copy the definition's children with {@code {role}} colors replaced from the default roles
     * merged with {@code overrides}. Unknown roles are left as written.
     */
    public List<Map<String, Object>> resolveColors(DecorativeDefinition definition, Map<String, String> overrides) {
        Map<String, String> palette = new HashMap<>(definition.colorRoles());
        if (overrides != null) {
            palette.putAll(overrides);
        }
        List<Map<String, Object>> resolved = new ArrayList<>();
        for (Map<String, Object> shape : definition.shapes()) {
            Map<String, Object> copy = new LinkedHashMap<>(shape);
            substitute(copy, "fill_color", palette);
            substitute(copy, "stroke_color", palette);
            resolved.add(copy);
        }
        return resolved;
    }

    /**
     * Scale each child's geometry and move it to the anchor; add the instance rotation and
     * give children without a layer the instance's layer.
     */
    public List<Map<String, Object>> applyTransforms(List<Map<String, Object>> shapes, Shape.DecorativeRef ref) {
        List<Map<String, Object>> transformed = new ArrayList<>();
        for (Map<String, Object> shape : shapes) {
            Map<String, Object> copy = new LinkedHashMap<>(shape);
            String type = String.valueOf(copy.get("type"));
            String[] positions = POSITION_FIELDS.getOrDefault(type, new String[0]);
            for (int i = 0; i < positions.length; i++) {
                double anchor = i % 2 == 0 ? ref.x() : ref.y();
                scaleField(copy, positions[i], ref.scale(), anchor);
            }
            for (String field : SIZE_FIELDS.getOrDefault(type, new String[0])) {
                scaleField(copy, field, ref.scale(), 0.0);
            }
            Object rotation = copy.get("rotation");
            if (rotation == null) {
                copy.put("rotation", ref.rotation() % 360);
            } else {
                Double base = numeric(rotation, "rotation");
                if (base != null) {
                    copy.put("rotation", (base + ref.rotation()) % 360);
                }
            }
            copy.putIfAbsent("z_index", ref.zIndex());
            transformed.add(copy);
        }
        return transformed;
    }

    private static void substitute(Map<String, Object> shape, String field, Map<String, String> palette) {
        if (shape.get(field) instanceof String value && value.startsWith("{") && value.endsWith("}")) {
            String role = value.substring(1, value.length() - 1);
            shape.put(field, palette.getOrDefault(role, value));
        }
    }

    private static void scaleField(Map<String, Object> shape, String field, double scale, double offset) {
        Object value = shape.get(field);
        if (value == null) {
            return;
        }
        Double number = numeric(value, field);
        if (number != null) {
            shape.put(field, number * scale + offset);
        }
    }

    // Unparsable values stay as written so the child fails parsing and is reported as skipped.
    private static Double numeric(Object value, String field) {
        try {
            return SceneElementParser.toDouble(value, field);
        } catch (ValidationException e) {
            log.warn("Decorative child field {} is not numeric: {}", field, value);
            return null;
        }
    }
}
