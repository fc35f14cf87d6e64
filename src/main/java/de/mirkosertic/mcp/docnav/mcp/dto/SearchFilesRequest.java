package de.mirkosertic.mcp.docnav.mcp.dto;

import de.mirkosertic.mcp.docnav.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for the searchFiles tool.
 */
public record SearchFilesRequest(
        @Description("Free text query, see the search tool.")
        String query,

        @Description("File paths relative to the index root. Every file is searched on its own.")
        List<String> files,

        @Nullable
        @Description("Maximum number of sections per file. Defaults to the configured limit.")
        Integer limit
) {
    public static SearchFilesRequest fromMap(final Map<String, Object> args) {
        final List<String> files;
        if (args.get("files") instanceof List<?> list) {
            files = list.stream().map(String::valueOf).toList();
        } else {
            files = List.of();
        }
        return new SearchFilesRequest(
                (String) args.get("query"),
                files,
                args.get("limit") != null ? ((Number) args.get("limit")).intValue() : null
        );
    }

    public int effectiveLimit(final int defaultLimit, final int maxLimit) {
        return (limit != null && limit > 0) ? Math.min(limit, maxLimit) : defaultLimit;
    }
}
