package de.mirkosertic.mcp.docnav.index;

public record TermWeight(String term, double idf) {
}
