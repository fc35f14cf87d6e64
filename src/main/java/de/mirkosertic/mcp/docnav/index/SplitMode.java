package de.mirkosertic.mcp.docnav.index;

import java.util.Locale;

/**
 * How {@link DocumentSplitter} cuts a file into chunks.
 */
public enum SplitMode {
    HEADINGS,
    LINES;

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static SplitMode parse(final String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
