package de.mirkosertic.mcp.docnav.search;

import de.mirkosertic.mcp.docnav.index.Section;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A ranked section.
 *
 * @param matchedTerms distinct query terms found in the section, in query order
 * @param preview      bounded excerpt of the section body, null when the index was loaded
 *                     from a snapshot and carries no bodies
 */
public record SearchResult(
        String file,
        String header,
        List<String> hierarchy,
        double score,
        List<String> matchedTerms,
        int lineStart,
        int lineEnd,
        @Nullable String preview
) {

    public String hierarchyPath() {
        return String.join(Section.HIERARCHY_SEPARATOR, hierarchy);
    }
}
