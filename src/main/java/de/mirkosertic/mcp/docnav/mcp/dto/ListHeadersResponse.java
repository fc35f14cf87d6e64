package de.mirkosertic.mcp.docnav.mcp.dto;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the listHeaders tool.
 */
public record ListHeadersResponse(
        boolean success,
        int fileCount,
        Map<String, List<String>> headers,
        String error
) {
    public static ListHeadersResponse success(final Map<String, List<String>> headers) {
        return new ListHeadersResponse(true, headers.size(), headers, null);
    }

    public static ListHeadersResponse error(final String errorMessage) {
        return new ListHeadersResponse(false, 0, null, errorMessage);
    }
}
