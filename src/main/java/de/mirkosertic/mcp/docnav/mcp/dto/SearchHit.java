package de.mirkosertic.mcp.docnav.mcp.dto;

import de.mirkosertic.mcp.docnav.mcp.Description;
import de.mirkosertic.mcp.docnav.search.SearchResult;

import java.util.List;

/**
 * A single ranked section in search results.
 */
public record SearchHit(
        @Description("File path relative to the index root")
        String file,

        @Description("Heading of the section, or the file path for unstructured files")
        String header,

        @Description("Enclosing headings, outermost first, joined with ' > '")
        String hierarchy,

        @Description("TF-IDF score")
        double score,

        @Description("Query terms found in the section, in query order")
        List<String> matchedTerms,

        @Description("First line of the section, 0-based")
        int lineStart,

        @Description("Line after the section, 0-based")
        int lineEnd,

        @Description("Excerpt of the section body, absent when previews were not requested")
        String preview
) {
    public static SearchHit from(final SearchResult result) {
        return new SearchHit(result.file(), result.header(), result.hierarchyPath(), result.score(),
                result.matchedTerms(), result.lineStart(), result.lineEnd(), result.preview());
    }
}
