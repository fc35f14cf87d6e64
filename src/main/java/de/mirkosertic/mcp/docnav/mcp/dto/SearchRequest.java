package de.mirkosertic.mcp.docnav.mcp.dto;

import com.google.common.base.Splitter;
import de.mirkosertic.mcp.docnav.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Request DTO for the search tool.
 */
public record SearchRequest(
        @Description("Free text query. Words are lower-cased, stopwords and words shorter than three characters are ignored.")
        String query,

        @Nullable
        @Description("Maximum number of sections to return. Defaults to the configured limit.")
        Integer limit,

        @Nullable
        @Description("Comma-separated list of file paths, relative to the index root, to restrict the search to.")
        String files,

        @Nullable
        @Description("Include a short excerpt of every matching section. Requires a rebuild of the index in memory. Default is true.")
        Boolean includePreview
) {
    private static final Splitter FILE_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    public static SearchRequest fromMap(final Map<String, Object> args) {
        final Object rawFiles = args.get("files");
        final String files;
        if (rawFiles instanceof List<?> list) {
            files = String.join(",", list.stream().map(String::valueOf).toList());
        } else {
            files = (String) rawFiles;
        }
        return new SearchRequest(
                (String) args.get("query"),
                args.get("limit") != null ? ((Number) args.get("limit")).intValue() : null,
                files,
                (Boolean) args.get("includePreview")
        );
    }

    public int effectiveLimit(final int defaultLimit, final int maxLimit) {
        return (limit != null && limit > 0) ? Math.min(limit, maxLimit) : defaultLimit;
    }

    /**
     * The file filter, or null when the search is not restricted.
     */
    public @Nullable Set<String> fileFilter() {
        if (files == null || files.isBlank()) {
            return null;
        }
        final Set<String> filter = new LinkedHashSet<>(FILE_SPLITTER.splitToList(files));
        return filter.isEmpty() ? null : filter;
    }

    public boolean effectiveIncludePreview() {
        return includePreview == null || includePreview;
    }
}
