package de.mirkosertic.mcp.docnav.index;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A complete index over one document collection, built wholesale by {@link IndexBuilder}.
 *
 * @param createdAt    ISO-8601 instant of the build
 * @param root         absolute path the build was rooted at
 * @param files        one record per indexed document, in collection order
 * @param sections     all sections, in collection and document order
 * @param idf          term to inverse document frequency over the section population
 * @param totalTokens  sum of the token counts of all files
 * @param totalChars   sum of the character counts of all files
 * @param skippedFiles relative paths of candidate files that could not be read
 */
public record CorpusIndex(
        String createdAt,
        String root,
        List<FileRecord> files,
        List<Section> sections,
        Map<String, Double> idf,
        long totalTokens,
        long totalChars,
        List<String> skippedFiles
) {

    public CorpusIndex {
        files = files == null ? List.of() : List.copyOf(files);
        sections = sections == null ? List.of() : List.copyOf(sections);
        idf = idf == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(idf));
        skippedFiles = skippedFiles == null ? List.of() : List.copyOf(skippedFiles);
    }

    /**
     * The persisted projection: identical except that every section body is dropped.
     */
    public CorpusIndex compacted() {
        return new CorpusIndex(createdAt, root, files,
                sections.stream().map(Section::withoutContent).toList(),
                idf, totalTokens, totalChars, skippedFiles);
    }

    /**
     * Most distinctive terms: highest IDF first, ties ordered alphabetically.
     */
    public List<TermWeight> mostDistinctiveTerms(final int limit) {
        return idf.entrySet().stream()
                .map(e -> new TermWeight(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingDouble(TermWeight::idf).reversed()
                        .thenComparing(TermWeight::term))
                .limit(Math.max(0, limit))
                .toList();
    }
}
