package de.mirkosertic.mcp.docnav.mcp.dto;

import de.mirkosertic.mcp.docnav.FilePreview;

import java.util.List;

/**
 * Response DTO for the previewFile tool.
 */
public record PreviewFileResponse(
        boolean success,
        String path,
        int totalLines,
        List<String> lines,
        boolean truncated,
        String error
) {
    public static PreviewFileResponse success(final FilePreview preview) {
        return new PreviewFileResponse(true, preview.path(), preview.totalLines(), preview.lines(),
                preview.truncated(), null);
    }

    public static PreviewFileResponse error(final String errorMessage) {
        return new PreviewFileResponse(false, null, 0, null, false, errorMessage);
    }
}
