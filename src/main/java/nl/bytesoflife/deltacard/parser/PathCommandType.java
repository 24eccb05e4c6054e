package nl.bytesoflife.deltacard.parser;

/**
 * Path-language commands and the size of one parameter group for each.
 */
public enum PathCommandType {
    MOVE_TO('M', 2),
    LINE_TO('L', 2),
    HORIZONTAL_LINE_TO('H', 1),
    VERTICAL_LINE_TO('V', 1),
    CURVE_TO('C', 6),
    SMOOTH_CURVE_TO('S', 4),
    QUADRATIC_CURVE_TO('Q', 4),
    SMOOTH_QUADRATIC_CURVE_TO('T', 2),
    ARC('A', 7),
    CLOSE_PATH('Z', 0);

    private final char letter;
    private final int parameterCount;

    PathCommandType(char letter, int parameterCount) {
        this.letter = letter;
        this.parameterCount = parameterCount;
    }

    public char getLetter() {
        return letter;
    }

    public int getParameterCount() {
        return parameterCount;
    }

    /**
     * Look up a command by letter, ignoring case. Returns null for letters outside the language.
     */
    public static PathCommandType fromLetter(char c) {
        char upper = Character.toUpperCase(c);
        for (PathCommandType type : values()) {
            if (type.letter == upper) {
                return type;
            }
        }
        return null;
    }
}
