package eu.virtualparadox.helpindex.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class TextCleaner {

    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]+");
    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B\\u200C\\u200D\\uFEFF]");
    private static final Pattern FORMAT_CHARS = Pattern.compile("\\p{Cf}");
    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cc}");
    private static final Pattern WHITESPACE_RUNS = Pattern.compile("\\s+");

    /**
     * Cleans extracted text by removing control characters, zero-width spaces,
     * and normalizing whitespace while keeping diacritics.
     *
     * @param input raw text, may be {@code null}
     * @return cleaned text, never {@code null}
     */
    public String cleanText(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        String text = LINE_BREAKS.matcher(input).replaceAll(" ");
        text = ZERO_WIDTH.matcher(text).replaceAll(" ");
        // non-breaking space -> space, soft hyphen -> removed
        text = text.replace('\u00A0', ' ').replace("\u00AD", "");
        // other format chars -> space (instead of remove)
        text = FORMAT_CHARS.matcher(text).replaceAll(" ");
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        return WHITESPACE_RUNS.matcher(text).replaceAll(" ").trim();
    }
}
