package de.mirkosertic.mcp.docnav.mcp.dto;

import de.mirkosertic.mcp.docnav.index.CorpusIndex;
import de.mirkosertic.mcp.docnav.index.TermWeight;

import java.util.List;

/**
 * Response DTO for the getIndexStats tool.
 */
public record IndexStatsResponse(
        boolean success,
        String root,
        String createdAt,
        String snapshotPath,
        int fileCount,
        int sectionCount,
        int termCount,
        long totalTokens,
        long totalChars,
        int skippedFileCount,
        String softwareVersion,
        String buildTimestamp,
        List<TermWeight> topTerms,
        String error
) {
    public static IndexStatsResponse success(final CorpusIndex index, final String snapshotPath,
                                             final String softwareVersion, final String buildTimestamp,
                                             final int topTermCount) {
        return new IndexStatsResponse(true, index.root(), index.createdAt(), snapshotPath,
                index.files().size(), index.sections().size(), index.idf().size(),
                index.totalTokens(), index.totalChars(), index.skippedFiles().size(),
                softwareVersion, buildTimestamp, index.mostDistinctiveTerms(topTermCount), null);
    }

    public static IndexStatsResponse error(final String errorMessage) {
        return new IndexStatsResponse(false, null, null, null, 0, 0, 0, 0, 0, 0, null, null, null, errorMessage);
    }
}
