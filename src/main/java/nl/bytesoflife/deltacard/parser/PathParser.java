package nl.bytesoflife.deltacard.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the path mini-language (the {@code d} attribute subset of SVG paths).
 * Produces commands only; coordinates are interpreted by the renderer.
 */
public class PathParser {

    private static final Logger log = LoggerFactory.getLogger(PathParser.class);

    private static final Pattern COMMAND_PATTERN = Pattern.compile("[MmLlHhVvCcSsQqTtAaZz]");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("[-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?");
    private static final Pattern LETTER = Pattern.compile("[a-zA-Z]");

    public List<PathCommand> parse(String pathData) {
        if (pathData == null || pathData.isBlank()) {
            throw new ParseException("Path data cannot be empty", 0);
        }
        String input = pathData.strip();
        List<PathCommand> commands = new ArrayList<>();

        Matcher matcher = COMMAND_PATTERN.matcher(input);
        if (!matcher.find()) {
            throw new ParseException("Expected command, got: " + input, 0);
        }
        String leading = input.substring(0, matcher.start()).trim();
        if (!leading.isEmpty()) {
            throw new ParseException("Expected command, got: " + leading, 0);
        }

        int start = matcher.start();
        char letter = input.charAt(start);
        while (true) {
            boolean more = matcher.find();
            int end = more ? matcher.start() : input.length();
            PathCommand command = parseCommand(letter, input.substring(start + 1, end), start);
            if (command != null) {
                commands.add(command);
            }
            if (!more) {
                break;
            }
            start = matcher.start();
            letter = input.charAt(start);
        }

        log.debug("Parsed {} path commands from '{}'", commands.size(), input);
        return commands;
    }

    private PathCommand parseCommand(char letter, String segment, int position) {
        PathCommandType type = PathCommandType.fromLetter(letter);

        // exponent markers inside numbers are blanked out, every other letter is unknown
        String masked = NUMBER_PATTERN.matcher(segment).replaceAll(m -> " ".repeat(m.group().length()));
        Matcher unknown = LETTER.matcher(masked);
        if (unknown.find()) {
            log.warn("Skipping unsupported path command '{}' at position {}",
                    unknown.group(), position + 1 + unknown.start());
            segment = segment.substring(0, unknown.start());
        }

        List<Double> params = parseNumbers(segment);
        int groupSize = type.getParameterCount();
        if (groupSize == 0) {
            if (!params.isEmpty()) {
                log.warn("Ignoring {} parameters after close command at position {}", params.size(), position);
            }
            return new PathCommand(type, Character.isLowerCase(letter), List.of());
        }
        if (params.isEmpty() || params.size() % groupSize != 0) {
            log.warn("Skipping path command '{}' at position {}: expects a multiple of {} parameters, got {}",
                    letter, position, groupSize, params.size());
            return null;
        }
        return new PathCommand(type, Character.isLowerCase(letter), params);
    }

    private List<Double> parseNumbers(String segment) {
        List<Double> numbers = new ArrayList<>();
        Matcher m = NUMBER_PATTERN.matcher(segment);
        while (m.find()) {
            numbers.add(Double.parseDouble(m.group()));
        }
        return numbers;
    }

    public static class ParseException extends RuntimeException {
        private final int position;

        public ParseException(String message, int position) {
            super(message);
            this.position = position;
        }

        public int getPosition() {
            return position;
        }
    }
}
