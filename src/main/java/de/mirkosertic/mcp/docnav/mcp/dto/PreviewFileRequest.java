package de.mirkosertic.mcp.docnav.mcp.dto;

import de.mirkosertic.mcp.docnav.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the previewFile tool.
 */
public record PreviewFileRequest(
        @Description("File path relative to the project root")
        String path,

        @Nullable
        @Description("Number of leading lines to return. Defaults to the configured preview length.")
        Integer lines
) {
    public static PreviewFileRequest fromMap(final Map<String, Object> args) {
        return new PreviewFileRequest(
                (String) args.get("path"),
                args.get("lines") != null ? ((Number) args.get("lines")).intValue() : null
        );
    }

    public int effectiveLines(final int defaultLines) {
        return (lines != null && lines > 0) ? lines : defaultLines;
    }
}
