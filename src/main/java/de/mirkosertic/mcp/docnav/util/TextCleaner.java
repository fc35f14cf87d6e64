package de.mirkosertic.mcp.docnav.util;

import java.util.regex.Pattern;

/**
 * Removes characters that break heading detection or produce unreadable previews.
 *
 * <p>Stripped characters:</p>
 * <ul>
 *   <li>U+0000 to U+0008, U+000B, U+000C, U+000E to U+001F: control characters other than tab, LF and CR</li>
 *   <li>U+200B, U+200C, U+200D: zero-width characters</li>
 *   <li>U+FEFF: byte order mark</li>
 *   <li>U+FFFD: replacement character left by lenient decoders</li>
 * </ul>
 */
public final class TextCleaner {

    private static final Pattern INVALID_CHARS = Pattern.compile(
            "[" +
            "\u0000-\u0008" +
            "\u000B-\u000C" +
            "\u000E-\u001F" +
            "\u200B-\u200D" +
            "\uFEFF" +
            "\uFFFD" +
            "]"
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private static final String ELLIPSIS = "...";

    private TextCleaner() {
    }

    /**
     * Strip invalid characters but keep line structure intact, so line numbers
     * computed on the result match the file on disk.
     *
     * @param text the text to clean (may be null)
     * @return cleaned text, or null if input was null
     */
    public static String stripInvalid(final String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return INVALID_CHARS.matcher(text).replaceAll("");
    }

    /**
     * Single-line preview: invalid characters removed, whitespace collapsed, cut to
     * {@code maxChars} with a trailing ellipsis when shortened.
     *
     * @param text     the text to preview (may be null)
     * @param maxChars maximum length of the preview including the ellipsis
     * @return the preview, or null if input was null
     */
    public static String preview(final String text, final int maxChars) {
        if (text == null) {
            return null;
        }
        final String flat = WHITESPACE_RUN.matcher(stripInvalid(text)).replaceAll(" ").trim();
        if (maxChars <= 0 || flat.length() <= maxChars) {
            return flat;
        }
        if (maxChars <= ELLIPSIS.length()) {
            return flat.substring(0, maxChars);
        }
        return flat.substring(0, maxChars - ELLIPSIS.length()).stripTrailing() + ELLIPSIS;
    }
}
