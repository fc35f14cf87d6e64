package de.mirkosertic.mcp.docnav.mcp.dto;

import java.util.List;

/**
 * Response DTO for the search tool.
 */
public record SearchResponse(
        boolean success,
        String query,
        List<SearchHit> hits,
        int hitCount,
        boolean previewsIncluded,
        long searchTimeMs,
        String error
) {
    public static SearchResponse success(final String query, final List<SearchHit> hits,
                                         final boolean previewsIncluded, final long searchTimeMs) {
        return new SearchResponse(true, query, hits, hits.size(), previewsIncluded, searchTimeMs, null);
    }

    public static SearchResponse error(final String errorMessage) {
        return new SearchResponse(false, null, null, 0, false, 0, errorMessage);
    }
}
