package de.mirkosertic.mcp.docnav;

import java.util.List;

/**
 * The leading lines of a file.
 *
 * @param path       path relative to the root the file was resolved against
 * @param totalLines number of lines in the whole file
 * @param lines      the returned lines, at most the requested number
 */
public record FilePreview(String path, int totalLines, List<String> lines) {

    public FilePreview {
        lines = List.copyOf(lines);
    }

    public boolean truncated() {
        return lines.size() < totalLines;
    }
}
