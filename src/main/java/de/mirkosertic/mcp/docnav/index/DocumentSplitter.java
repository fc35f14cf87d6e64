package de.mirkosertic.mcp.docnav.index;

import de.mirkosertic.mcp.docnav.TermTokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a single document into chunks that can be read one at a time.
 * <p>
 * Heading mode reuses the section extraction, so its chunk boundaries are exactly the
 * section boundaries of the index. Line mode produces fixed-size windows.
 */
public final class DocumentSplitter {

    /**
     * @param index     0-based position of the chunk
     * @param label     section header, or a line range description in line mode
     * @param lineStart first line, 0-based, inclusive
     * @param lineEnd   line after the chunk, exclusive
     * @param chars     characters of the chunk body
     * @param tokens    index terms in the chunk
     */
    public record Chunk(int index, String label, int lineStart, int lineEnd, int chars, int tokens) {
    }

    private DocumentSplitter() {
    }

    public static List<Chunk> split(final String text, final String path, final SplitMode mode, final int chunkLines) {
        return switch (mode) {
            case HEADINGS -> byHeadings(text, path);
            case LINES -> byLines(text, chunkLines);
        };
    }

    public static List<Chunk> byHeadings(final String text, final String fallbackHeader) {
        final List<Section> sections = SectionExtractor.extractSections(text, fallbackHeader);
        final List<Chunk> chunks = new ArrayList<>(sections.size());
        for (final Section section : sections) {
            final String label = section.hierarchy().isEmpty()
                    ? section.header()
                    : section.hierarchyPath() + Section.HIERARCHY_SEPARATOR + section.header();
            final int chars = section.content() != null ? section.content().length() : 0;
            chunks.add(new Chunk(chunks.size(), label, section.lineStart(), section.lineEnd(),
                    chars, section.tokens().size()));
        }
        return chunks;
    }

    /**
     * @throws IllegalArgumentException if {@code chunkLines} is not positive
     */
    public static List<Chunk> byLines(final String text, final int chunkLines) {
        if (chunkLines <= 0) {
            throw new IllegalArgumentException("chunkLines must be positive, was " + chunkLines);
        }
        final List<String> lines = SectionExtractor.splitLines(text);
        final List<Chunk> chunks = new ArrayList<>();
        for (int start = 0; start < lines.size(); start += chunkLines) {
            final int end = Math.min(lines.size(), start + chunkLines);
            final String body = String.join("\n", lines.subList(start, end));
            chunks.add(new Chunk(chunks.size(), "lines " + (start + 1) + "-" + end, start, end,
                    body.length(), TermTokenizer.tokenize(body).size()));
        }
        return chunks;
    }
}
