package de.mirkosertic.mcp.docnav.crawler;

import java.util.List;
import java.util.Locale;

/**
 * Decides which files of a collection are indexed.
 * <p>
 * A file is a candidate when its name ends with one of the allowed extensions and its
 * path relative to the collection root contains none of the excluded fragments.
 */
public class FilePatternMatcher {

    private final List<String> includeExtensions;
    private final List<String> excludeFragments;
    private final List<String> structuredExtensions;

    public FilePatternMatcher(final List<String> includeExtensions, final List<String> excludeFragments,
                              final List<String> structuredExtensions) {
        this.includeExtensions = normalize(includeExtensions);
        this.excludeFragments = List.copyOf(excludeFragments);
        this.structuredExtensions = normalize(structuredExtensions);
    }

    private static List<String> normalize(final List<String> extensions) {
        return extensions.stream()
                .map(ext -> ext.startsWith(".") ? ext : "." + ext)
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * @param relativePath path relative to the collection root, '/'-separated
     */
    public boolean shouldInclude(final String relativePath) {
        return !isExcluded(relativePath) && hasExtension(relativePath, includeExtensions);
    }

    /**
     * @param relativePath path relative to the collection root, '/'-separated; directories included
     */
    public boolean isExcluded(final String relativePath) {
        for (final String fragment : excludeFragments) {
            if (relativePath.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the file is heading-structured text rather than code.
     */
    public boolean isStructured(final String relativePath) {
        return hasExtension(relativePath, structuredExtensions);
    }

    private static boolean hasExtension(final String relativePath, final List<String> extensions) {
        final String lower = relativePath.toLowerCase(Locale.ROOT);
        for (final String extension : extensions) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
