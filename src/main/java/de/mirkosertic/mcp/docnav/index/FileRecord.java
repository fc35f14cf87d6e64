package de.mirkosertic.mcp.docnav.index;

/**
 * Per-document metadata captured once per build.
 */
public record FileRecord(
        String path,
        long size,
        int lines,
        int tokens
) {
}
