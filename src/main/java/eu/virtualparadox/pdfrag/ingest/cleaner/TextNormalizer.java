package eu.virtualparadox.pdfrag.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Normalizes extracted PDF text before chunking.
 * <p>
 * Blank lines survive as a single paragraph break ({@code "\n\n"}) so that paragraph chunking
 * can still see them; every other line break is folded into a space.
 * </p>
 */
@Component
public class TextNormalizer {

    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B\\u200C\\u200D\\uFEFF]");
    private static final Pattern FORMAT_CHARS = Pattern.compile("\\p{Cf}");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}&&[^\\n\\t]]");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[\\t \\x0B\\f]+");
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" *\\n *");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n{2,}");
    private static final Pattern SINGLE_NEWLINE = Pattern.compile("(?<!\\n)\\n(?!\\n)");
    private static final Pattern RUN_ON_SENTENCE = Pattern.compile("\\.(\\p{Lu})");

    /**
     * Cleans extracted text by removing control characters, zero-width spaces,
     * and normalizing whitespace while keeping diacritics and paragraph breaks.
     *
     * @param input raw text, may be {@code null}
     * @return normalized text, never {@code null}
     */
    public String normalize(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        String text = input.replace("\r\n", "\n").replace('\r', '\n');
        // zero-width and similar -> SPACE
        text = ZERO_WIDTH.matcher(text).replaceAll(" ");
        // non-breaking space -> SPACE
        text = text.replace('\u00A0', ' ');
        // soft hyphen -> remove
        text = text.replace("\u00AD", "");
        text = FORMAT_CHARS.matcher(text).replaceAll(" ");
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        text = HORIZONTAL_SPACE.matcher(text).replaceAll(" ");
        text = SPACE_AROUND_NEWLINE.matcher(text).replaceAll("\n");
        text = PARAGRAPH_BREAK.matcher(text).replaceAll("\n\n");
        text = SINGLE_NEWLINE.matcher(text).replaceAll(" ");
        text = RUN_ON_SENTENCE.matcher(text).replaceAll(". $1");
        return text.trim();
    }
}
