package de.mirkosertic.mcp.docnav.index;

import de.mirkosertic.mcp.docnav.TermTokenizer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decomposes document text into sections.
 * <p>
 * Structured mode scans line by line for Markdown headings ({@code #} to {@code ####}).
 * The current ancestry is kept as an explicit stack of (depth, title) frames: a new heading
 * pops every frame at the same or a deeper level and is then pushed, so siblings replace
 * each other and deeper headings nest under the open shallower ones.
 * <p>
 * Line ranges of the returned sections partition the document. A heading line belongs to the
 * section it opens. A heading without body text produces no section of its own; its lines go
 * to the next emitted section, and trailing empty lines go to the last one.
 * <p>
 * Sections are returned without an owning file, see {@link Section#withFile(String)}.
 */
public final class SectionExtractor {

    private static final Pattern HEADING = Pattern.compile("^(#{1,4})\\s+(\\S.*?)\\s*$");

    private record HeadingFrame(int depth, String title) {
    }

    private SectionExtractor() {
    }

    /**
     * Split structured text into heading-delimited sections.
     *
     * @param text           document text
     * @param fallbackHeader header for text before the first heading, usually the file path
     * @return sections in document order, never empty
     */
    public static List<Section> extractSections(final String text, final String fallbackHeader) {
        final List<String> lines = splitLines(text);
        final List<Section> sections = new ArrayList<>();
        final Deque<HeadingFrame> stack = new ArrayDeque<>();
        final List<String> body = new ArrayList<>();

        int sectionStart = 0;
        for (int lineNo = 0; lineNo < lines.size(); lineNo++) {
            final Matcher heading = HEADING.matcher(lines.get(lineNo));
            if (!heading.matches()) {
                body.add(lines.get(lineNo));
                continue;
            }

            if (emitSection(sections, body, stack, fallbackHeader, sectionStart, lineNo)) {
                sectionStart = lineNo;
            }

            final int depth = heading.group(1).length();
            while (!stack.isEmpty() && stack.peekLast().depth() >= depth) {
                stack.removeLast();
            }
            stack.addLast(new HeadingFrame(depth, heading.group(2)));
            body.clear();
        }

        final boolean flushed = emitSection(sections, body, stack, fallbackHeader, sectionStart, lines.size());

        if (sections.isEmpty()) {
            // No heading carried any body text
            sections.add(new Section(null, fallbackHeader, List.of(), text,
                    TermTokenizer.tokenize(text + " " + fallbackHeader), 0, lines.size()));
        } else if (!flushed) {
            final int last = sections.size() - 1;
            sections.set(last, sections.get(last).withLineEnd(lines.size()));
        }

        return sections;
    }

    /**
     * A single section spanning the whole document, for code and other unstructured files.
     * The stored body is cut to {@code previewChars}; tokens always come from the full text.
     *
     * @param previewChars maximum body length, zero or negative for no limit
     */
    public static Section extractWholeDocument(final String text, final String path, final int previewChars) {
        String preview = text;
        if (previewChars > 0 && text.length() > previewChars) {
            int end = previewChars;
            // Never cut between the two halves of a surrogate pair
            if (Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            preview = text.substring(0, end);
        }
        return new Section(null, path, List.of(), preview, TermTokenizer.tokenize(text),
                0, splitLines(text).size());
    }

    /**
     * Lines as the index counts them: a trailing line terminator does not open another line.
     */
    public static List<String> splitLines(final String text) {
        return text.lines().toList();
    }

    private static boolean emitSection(final List<Section> sections, final List<String> body,
                                       final Deque<HeadingFrame> stack, final String fallbackHeader,
                                       final int lineStart, final int lineEnd) {
        final String content = String.join("\n", body);
        if (content.isBlank()) {
            return false;
        }

        final List<String> hierarchy = new ArrayList<>();
        stack.forEach(frame -> hierarchy.add(frame.title()));
        final String header;
        if (hierarchy.isEmpty()) {
            header = fallbackHeader;
        } else {
            header = hierarchy.remove(hierarchy.size() - 1);
        }

        sections.add(new Section(null, header, hierarchy, content,
                TermTokenizer.tokenize(content + " " + header), lineStart, lineEnd));
        return true;
    }
}
