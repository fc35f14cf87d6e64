package de.mirkosertic.mcp.docnav.mcp.dto;

import de.mirkosertic.mcp.docnav.index.DocumentSplitter;

import java.util.List;

/**
 * Response DTO for the splitFile tool.
 */
public record SplitFileResponse(
        boolean success,
        String path,
        String mode,
        int chunkCount,
        List<DocumentSplitter.Chunk> chunks,
        String error
) {
    public static SplitFileResponse success(final String path, final String mode,
                                            final List<DocumentSplitter.Chunk> chunks) {
        return new SplitFileResponse(true, path, mode, chunks.size(), chunks, null);
    }

    public static SplitFileResponse error(final String errorMessage) {
        return new SplitFileResponse(false, null, null, 0, null, errorMessage);
    }
}
