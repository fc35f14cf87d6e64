package de.mirkosertic.mcp.docnav.crawler;

import java.nio.file.Path;

/**
 * A file selected for indexing.
 *
 * @param path         absolute location on disk
 * @param relativePath path relative to the collection root, '/'-separated
 */
public record CandidateFile(Path path, String relativePath) {
}
