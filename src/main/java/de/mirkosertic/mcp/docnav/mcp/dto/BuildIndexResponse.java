package de.mirkosertic.mcp.docnav.mcp.dto;

import de.mirkosertic.mcp.docnav.index.CorpusIndex;

import java.util.List;

/**
 * Response DTO for the buildIndex tool.
 */
public record BuildIndexResponse(
        boolean success,
        String root,
        String snapshotPath,
        int fileCount,
        int sectionCount,
        int termCount,
        long totalTokens,
        long totalChars,
        List<String> skippedFiles,
        long durationMs,
        String error
) {
    public static BuildIndexResponse success(final CorpusIndex index, final String snapshotPath, final long durationMs) {
        return new BuildIndexResponse(true, index.root(), snapshotPath, index.files().size(),
                index.sections().size(), index.idf().size(), index.totalTokens(), index.totalChars(),
                index.skippedFiles(), durationMs, null);
    }

    public static BuildIndexResponse error(final String errorMessage) {
        return new BuildIndexResponse(false, null, null, 0, 0, 0, 0, 0, null, 0, errorMessage);
    }
}
