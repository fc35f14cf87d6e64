package de.mirkosertic.mcp.docnav.mcp.dto;

import de.mirkosertic.mcp.docnav.index.SplitMode;
import de.mirkosertic.mcp.docnav.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the splitFile tool.
 */
public record SplitFileRequest(
        @Description("File path relative to the project root")
        String path,

        @Nullable
        @Description("'headings' cuts at Markdown headings, 'lines' cuts fixed-size line windows. Default is 'headings'.")
        SplitMode mode,

        @Nullable
        @Description("Lines per chunk in 'lines' mode. Defaults to the configured chunk size.")
        Integer chunkLines
) {
    /**
     * @throws IllegalArgumentException for an unknown mode
     */
    public static SplitFileRequest fromMap(final Map<String, Object> args) {
        final Object mode = args.get("mode");
        return new SplitFileRequest(
                (String) args.get("path"),
                mode != null ? SplitMode.parse(mode.toString()) : null,
                args.get("chunkLines") != null ? ((Number) args.get("chunkLines")).intValue() : null
        );
    }

    public SplitMode effectiveMode() {
        return mode != null ? mode : SplitMode.HEADINGS;
    }

    public int effectiveChunkLines(final int defaultChunkLines) {
        return chunkLines != null ? chunkLines : defaultChunkLines;
    }
}
