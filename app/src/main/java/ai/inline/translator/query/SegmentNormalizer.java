package ai.inline.translator.query;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits and rejoins {@code |}-delimited segments.
 */
public final class SegmentNormalizer {

    public static final String DELIMITER = "|";
    public static final int MAX_TEXT_LENGTH = 2048;

    private static final Pattern DELIMITER_PATTERN = Pattern.compile(Pattern.quote(DELIMITER));
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\p{IsWhite_Space}+|\\p{IsWhite_Space}+$");

    private SegmentNormalizer() {
    }

    /**
     * Truncates to {@link #MAX_TEXT_LENGTH} code points, then drops blank segments and strips the rest.
     */
    public static String normalize(String raw) {
        return String.join(DELIMITER, segments(truncate(raw, MAX_TEXT_LENGTH)));
    }

    /**
     * Renders segments one per line for display.
     */
    public static String toLines(String value) {
        return String.join("\n", segments(value));
    }

    public static List<String> segments(String value) {
        if (value == null || value.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(DELIMITER_PATTERN.split(value, -1))
                .map(SegmentNormalizer::trimWhitespace)
                .filter(segment -> !segment.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Removes leading and trailing Unicode white space, including the no-break spaces {@link String#strip()} keeps.
     */
    public static String trimWhitespace(String value) {
        return EDGE_WHITESPACE.matcher(value).replaceAll("");
    }

    static String truncate(String value, int maxCodePoints) {
        if (value.codePointCount(0, value.length()) <= maxCodePoints) {
            return value;
        }
        return value.substring(0, value.offsetByCodePoints(0, maxCodePoints));
    }
}
