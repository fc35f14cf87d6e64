package de.mirkosertic.mcp.docnav.mcp.dto;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the searchFiles tool. Hits are grouped by file in request order;
 * files without a match map to an empty list.
 */
public record SearchFilesResponse(
        boolean success,
        String query,
        Map<String, List<SearchHit>> results,
        long searchTimeMs,
        String error
) {
    public static SearchFilesResponse success(final String query, final Map<String, List<SearchHit>> results,
                                              final long searchTimeMs) {
        return new SearchFilesResponse(true, query, results, searchTimeMs, null);
    }

    public static SearchFilesResponse error(final String errorMessage) {
        return new SearchFilesResponse(false, null, null, 0, errorMessage);
    }
}
