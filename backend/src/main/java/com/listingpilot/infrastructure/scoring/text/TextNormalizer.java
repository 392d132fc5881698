package com.listingpilot.infrastructure.scoring.text;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Cleans generated listing copy before it is scored:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Markdown emphasis markers left behind by the generator
 * - Whitespace normalization (collapse runs, trim)
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except \n, \r, \t
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    // **bold** and __bold__ markers
    private static final Pattern MARKDOWN_EMPHASIS = Pattern.compile("\\*\\*|__");

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t]{2,}");

    private static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");

    private static final Pattern ANY_WHITESPACE = Pattern.compile("\\s+");

    /**
     * Normalize multi-line text such as a description or a bullet block.
     *
     * @param text raw generated text (nullable)
     * @return normalized text, empty for null
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = MARKDOWN_EMPHASIS.matcher(result).replaceAll("");
        result = result.replace("\r\n", "\n").replace("\r", "\n");
        result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");
        result = EXCESSIVE_NEWLINES.matcher(result).replaceAll("\n\n");

        return result.strip();
    }

    /**
     * Normalize a single-line field such as a title: every whitespace run becomes one space.
     */
    public String normalizeLine(String text) {
        String result = normalize(text);
        return ANY_WHITESPACE.matcher(result).replaceAll(" ");
    }
}
