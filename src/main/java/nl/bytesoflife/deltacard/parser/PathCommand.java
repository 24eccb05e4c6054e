package nl.bytesoflife.deltacard.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * One parsed path command. A command may carry several parameter groups (e.g. {@code L 1 1 2 2}),
 * which are interpreted as repeats of the same command.
 */
public record PathCommand(PathCommandType type, boolean relative, List<Double> params) {

    public PathCommand {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        params = params == null ? List.of() : List.copyOf(params);
    }

    public static PathCommand of(char letter, double... params) {
        PathCommandType type = PathCommandType.fromLetter(letter);
        if (type == null) {
            throw new IllegalArgumentException("Unknown path command: " + letter);
        }
        List<Double> values = new ArrayList<>(params.length);
        for (double p : params) {
            values.add(p);
        }
        return new PathCommand(type, Character.isLowerCase(letter), values);
    }

    public char letter() {
        return relative ? Character.toLowerCase(type.getLetter()) : type.getLetter();
    }

    public int groupCount() {
        int size = type.getParameterCount();
        return size == 0 ? 1 : params.size() / size;
    }

    public double[] group(int index) {
        int size = type.getParameterCount();
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = params.get(index * size + i);
        }
        return values;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(letter());
        for (Double p : params) {
            sb.append(' ').append(p);
        }
        return sb.toString();
    }
}
