package nl.bytesoflife.deltacard.parser;

import nl.bytesoflife.deltacard.model.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds scene model objects from key-value descriptions as produced by a template loader.
 * Each union is selected by its {@code type} field; unknown discriminators and malformed
 * values fail with {@link ValidationException}.
 */
public class SceneElementParser {

    public Card parseCard(Map<String, Object> map) {
        List<Panel> panels = new ArrayList<>();
        for (Map<String, Object> panel : mapList(map, "panels")) {
            panels.add(parsePanel(panel));
        }
        return new Card(string(map, "name", null), FoldType.fromKey(requiredString(map, "fold_type")), panels);
    }

    public Panel parsePanel(Map<String, Object> map) {
        List<Shape> shapes = new ArrayList<>();
        for (Map<String, Object> shape : mapList(map, "shape_elements")) {
            shapes.add(parseShape(shape));
        }
        List<TextElement> texts = new ArrayList<>();
        for (Map<String, Object> text : mapList(map, "text_elements")) {
            texts.add(parseText(text));
        }
        List<ImageElement> images = new ArrayList<>();
        for (Map<String, Object> image : mapList(map, "image_elements")) {
            images.add(parseImage(image));
        }
        return new Panel(
                string(map, "id", null),
                PanelPosition.fromKey(requiredString(map, "position")),
                number(map, "x"),
                number(map, "y"),
                number(map, "width"),
                number(map, "height"),
                number(map, "rotation", 0.0),
                optionalColor(map, "background_color"),
                map.get("border") != null ? parseBorder(submap(map, "border")) : null,
                shapes, texts, images);
    }

    public Border parseBorder(Map<String, Object> map) {
        return new Border(
                BorderStyle.fromKey(string(map, "style", "solid")),
                number(map, "width", 1.0),
                map.get("color") != null ? color(map.get("color"), "color") : Color.BLACK,
                number(map, "corner_radius", 0.0));
    }

    public Shape parseShape(Map<String, Object> map) {
        String type = requiredString(map, "type");
        return switch (type) {
            case "rectangle" -> new Shape.Rectangle(parseStyle(map),
                    number(map, "x"), number(map, "y"), number(map, "width"), number(map, "height"));
            case "circle" -> new Shape.Circle(parseStyle(map),
                    number(map, "center_x"), number(map, "center_y"), number(map, "radius"));
            case "triangle" -> new Shape.Triangle(parseStyle(map),
                    new Point(number(map, "x1"), number(map, "y1")),
                    new Point(number(map, "x2"), number(map, "y2")),
                    new Point(number(map, "x3"), number(map, "y3")));
            case "star" -> new Shape.Star(parseStyle(map),
                    number(map, "center_x"), number(map, "center_y"),
                    number(map, "outer_radius"), number(map, "inner_radius"),
                    integer(map, "points", 5));
            case "line" -> new Shape.Line(parseStyle(map),
                    new Point(number(map, "start_x"), number(map, "start_y")),
                    new Point(number(map, "end_x"), number(map, "end_y")));
            case "svg_path" -> new Shape.Path(parseStyle(map),
                    requiredString(map, "path_data"), number(map, "scale", 1.0));
            case "decorative_element" -> parseDecorativeRef(map);
            default -> throw new ValidationException("Unknown shape type: " + type);
        };
    }

    private Shape.DecorativeRef parseDecorativeRef(Map<String, Object> map) {
        Map<String, String> palette = new LinkedHashMap<>();
        Object raw = map.get("color_palette");
        if (raw instanceof Map<?, ?> entries) {
            for (Map.Entry<?, ?> entry : entries.entrySet()) {
                palette.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
            }
        } else if (raw != null) {
            throw new ValidationException("color_palette must be a mapping, got: " + raw);
        }
        return new Shape.DecorativeRef(
                string(map, "id", null),
                requiredString(map, "name"),
                number(map, "x"),
                number(map, "y"),
                number(map, "scale", 1.0),
                number(map, "rotation", 0.0),
                palette,
                integer(map, "z_index", 0));
    }

    private ShapeStyle parseStyle(Map<String, Object> map) {
        return ShapeStyle.builder()
                .id(string(map, "id", null))
                .zIndex(integer(map, "z_index", 0))
                .opacity(number(map, "opacity", 1.0))
                .rotation(number(map, "rotation", 0.0))
                .strokeColor(optionalColor(map, "stroke_color"))
                .strokeWidth(number(map, "stroke_width", 0.0))
                .fill(map.get("fill") != null ? parseFill(submap(map, "fill")) : null)
                .fillColor(optionalColor(map, "fill_color"))
                .build();
    }

    public FillStyle parseFill(Map<String, Object> map) {
        String type = requiredString(map, "type");
        return switch (type) {
            case "solid" -> new FillStyle.Solid(color(map.get("color"), "color"));
            case "linear_gradient" -> new FillStyle.LinearGradient(number(map, "angle", 0.0), stops(map));
            case "radial_gradient" -> new FillStyle.RadialGradient(
                    number(map, "center_x", 0.5), number(map, "center_y", 0.5), number(map, "radius", 0.5),
                    stops(map));
            case "pattern" -> new FillStyle.Pattern(
                    PatternKind.fromKey(requiredString(map, "pattern_type")),
                    colors(map, "colors"),
                    number(map, "spacing", FillStyle.Pattern.DEFAULT_SPACING),
                    number(map, "scale", 1.0),
                    number(map, "rotation", 0.0));
            default -> throw new ValidationException("Unknown fill type: " + type);
        };
    }

    public ClipMask parseClipMask(Map<String, Object> map) {
        String type = requiredString(map, "type");
        return switch (type) {
            case "circle" -> new ClipMask.Circle(number(map, "center_x"), number(map, "center_y"),
                    number(map, "radius"));
            case "rectangle" -> new ClipMask.Rectangle(number(map, "x"), number(map, "y"),
                    number(map, "width"), number(map, "height"));
            case "ellipse" -> new ClipMask.Ellipse(number(map, "center_x"), number(map, "center_y"),
                    number(map, "radius_x"), number(map, "radius_y"));
            case "star" -> new ClipMask.Star(number(map, "center_x"), number(map, "center_y"),
                    number(map, "outer_radius"), number(map, "inner_radius"), integer(map, "points", 5));
            case "svg_path" -> new ClipMask.Path(requiredString(map, "path_data"), number(map, "scale", 1.0));
            default -> throw new ValidationException("Unknown clip mask type: " + type);
        };
    }

    public TextElement parseText(Map<String, Object> map) {
        Object maxLines = map.get("max_lines");
        return new TextElement(
                string(map, "id", null),
                requiredString(map, "content"),
                number(map, "x"),
                number(map, "y"),
                optionalNumber(map, "width"),
                string(map, "font_family", "Helvetica"),
                integer(map, "font_size", 12),
                FontStyle.fromKey(string(map, "font_style", "normal")),
                optionalColor(map, "color"),
                TextAlignment.fromKey(string(map, "alignment", "left")),
                number(map, "rotation", 0.0),
                integer(map, "z_index", 100),
                OverflowPolicy.fromKey(string(map, "overflow_strategy", "auto")),
                maxLines != null ? integer(map, "max_lines", 0) : null,
                integer(map, "min_font_size", 8));
    }

    public ImageElement parseImage(Map<String, Object> map) {
        Object preserve = map.getOrDefault("preserve_aspect", Boolean.TRUE);
        return new ImageElement(
                string(map, "id", null),
                requiredString(map, "source_path"),
                number(map, "x"),
                number(map, "y"),
                optionalNumber(map, "width"),
                optionalNumber(map, "height"),
                preserve instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(preserve)),
                number(map, "rotation", 0.0),
                number(map, "opacity", 1.0),
                integer(map, "z_index", 100),
                map.get("clip_mask") != null ? parseClipMask(submap(map, "clip_mask")) : null);
    }

    private List<ColorStop> stops(Map<String, Object> map) {
        List<ColorStop> stops = new ArrayList<>();
        for (Map<String, Object> stop : mapList(map, "stops")) {
            stops.add(new ColorStop(number(stop, "position"), color(stop.get("color"), "color")));
        }
        return stops;
    }

    private List<Color> colors(Map<String, Object> map, String key) {
        Object raw = map.get(key);
        if (!(raw instanceof List<?> values)) {
            throw new ValidationException("Field '" + key + "' must be a list of colors");
        }
        List<Color> colors = new ArrayList<>();
        for (Object value : values) {
            colors.add(color(value, key));
        }
        return colors;
    }

    // --- value helpers ---

    private static Color optionalColor(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? null : color(value, key);
    }

    private static Color color(Object value, String key) {
        if (value instanceof String s) {
            return Color.fromHex(s);
        }
        if (value instanceof Map<?, ?> rgb) {
            return new Color(toDouble(rgb.get("r"), key + ".r"),
                    toDouble(rgb.get("g"), key + ".g"),
                    toDouble(rgb.get("b"), key + ".b"));
        }
        throw new ValidationException("Field '" + key + "' is not a color: " + value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> submap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        throw new ValidationException("Field '" + key + "' must be a mapping, got: " + value);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> mapList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ValidationException("Field '" + key + "' must be a list, got: " + value);
        }
        for (Object item : list) {
            if (!(item instanceof Map)) {
                throw new ValidationException("Field '" + key + "' must contain mappings, got: " + item);
            }
        }
        return (List<Map<String, Object>>) list;
    }

    private static String requiredString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            throw new ValidationException("Missing required field '" + key + "'");
        }
        return String.valueOf(value);
    }

    private static String string(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value == null ? defaultValue : String.valueOf(value);
    }

    private static double number(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            throw new ValidationException("Missing required field '" + key + "'");
        }
        return toDouble(value, key);
    }

    private static double number(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        return value == null ? defaultValue : toDouble(value, key);
    }

    private static Double optionalNumber(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? null : toDouble(value, key);
    }

    private static int integer(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        double d = toDouble(value, key);
        if (d != Math.rint(d)) {
            throw new ValidationException("Field '" + key + "' must be an integer, got: " + value);
        }
        if (d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
            throw new ValidationException("Field '" + key + "' is out of integer range: " + value);
        }
        return (int) d;
    }

    /**
     * Numeric field value: a {@link Number} or a numeric string.
     *
     * @throws ValidationException for anything else
     */
    public static double toDouble(Object value, String key) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Field '" + key + "' is not a number: " + s, e);
            }
        }
        throw new ValidationException("Field '" + key + "' is not a number: " + value);
    }
}
