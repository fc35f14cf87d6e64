package de.mirkosertic.mcp.docnav.index;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * The atomic retrievable unit of the index: a heading-delimited span of a document,
 * or a whole document when it has no usable structure.
 *
 * <p>{@code content} is only present in freshly built indexes. Persisted snapshots drop it,
 * so callers that need section bodies have to rebuild.</p>
 *
 * @param file      owning document, relative to the index root; null until the builder assigns it
 * @param header    nearest enclosing heading, or the fallback header (usually the file path)
 * @param hierarchy ancestor heading titles, outermost first, excluding {@code header}
 * @param content   raw section body, null when compacted
 * @param tokens    terms of header and body, with duplicates
 * @param lineStart first line of the section, 0-based, inclusive
 * @param lineEnd   line after the section, exclusive
 */
public record Section(
        @Nullable String file,
        String header,
        List<String> hierarchy,
        @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable String content,
        List<String> tokens,
        int lineStart,
        int lineEnd
) {

    public static final String HIERARCHY_SEPARATOR = " > ";

    public Section {
        hierarchy = hierarchy == null ? List.of() : List.copyOf(hierarchy);
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    public Section withFile(final String owningFile) {
        return new Section(owningFile, header, hierarchy, content, tokens, lineStart, lineEnd);
    }

    public Section withLineEnd(final int newLineEnd) {
        return new Section(file, header, hierarchy, content, tokens, lineStart, newLineEnd);
    }

    public Section withoutContent() {
        return new Section(file, header, hierarchy, null, tokens, lineStart, lineEnd);
    }

    /**
     * Ancestors joined for display, empty for top-level sections.
     */
    public String hierarchyPath() {
        return String.join(HIERARCHY_SEPARATOR, hierarchy);
    }
}
