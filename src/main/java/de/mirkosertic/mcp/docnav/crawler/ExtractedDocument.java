package de.mirkosertic.mcp.docnav.crawler;

public record ExtractedDocument(
        String content,
        long fileSize
) {
}
