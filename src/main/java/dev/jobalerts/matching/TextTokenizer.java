package dev.jobalerts.matching;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits text into comparable tokens for tokenized matching.
 */
public final class TextTokenizer {

    // One trailing level suffix: Roman I-VIII or a decimal number ("Engineer II", "Analyst 3")
    private static final Pattern TRAILING_SUFFIX =
            Pattern.compile("\\s+(?:I{1,3}|IV|VI{0,3}|[0-9]+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NON_WORD =
            Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextTokenizer() {
    }

    /**
     * Strip a trailing numeral suffix, replace punctuation with spaces and split.
     */
    public static List<String> tokenize(String text) {
        if (text == null) {
            return List.of();
        }
        String stripped = TRAILING_SUFFIX.matcher(text.strip()).replaceFirst("");
        String cleaned = NON_WORD.matcher(stripped).replaceAll(" ").strip();
        if (cleaned.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(WHITESPACE.split(cleaned));
    }
}
