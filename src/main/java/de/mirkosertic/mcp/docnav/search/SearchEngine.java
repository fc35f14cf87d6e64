package de.mirkosertic.mcp.docnav.search;

import de.mirkosertic.mcp.docnav.TermTokenizer;
import de.mirkosertic.mcp.docnav.index.CorpusIndex;
import de.mirkosertic.mcp.docnav.index.Section;
import de.mirkosertic.mcp.docnav.util.TextCleaner;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TF-IDF ranking over the sections of a {@link CorpusIndex}.
 * <p>
 * For every distinct query term present in a section the score grows by
 * {@code count / max(1, sectionTokens) * idf(term)}. Terms missing from the IDF table
 * weigh {@value #DEFAULT_IDF}, so query terms that are too common (or unknown) to be
 * weighted still count. Sections without any matched term are not returned.
 * Ties keep the original section order.
 */
public class SearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(SearchEngine.class);

    public static final double DEFAULT_IDF = 1.0;

    private final int previewChars;

    /**
     * @param previewChars maximum length of result previews
     */
    public SearchEngine(final int previewChars) {
        this.previewChars = previewChars;
    }

    /**
     * @param index      the index to search, previews are only produced when it carries section bodies
     * @param query      free text
     * @param topN       maximum number of results
     * @param fileFilter if not null, only sections of these files are scored
     * @return results ordered by descending score, empty for term-free queries
     */
    public List<SearchResult> search(final CorpusIndex index, final String query, final int topN,
                                     final @Nullable Set<String> fileFilter) {
        final List<String> distinctTerms = new ArrayList<>(new LinkedHashSet<>(TermTokenizer.tokenize(query)));
        if (distinctTerms.isEmpty() || topN <= 0) {
            logger.debug("Query '{}' has no searchable terms", query);
            return List.of();
        }

        final List<SearchResult> results = new ArrayList<>();
        for (final Section section : index.sections()) {
            if (fileFilter != null && !fileFilter.contains(section.file())) {
                continue;
            }

            final Map<String, Integer> counts = termCounts(section.tokens());
            final int sectionLength = Math.max(1, section.tokens().size());

            double score = 0.0;
            final List<String> matched = new ArrayList<>();
            for (final String term : distinctTerms) {
                final Integer count = counts.get(term);
                if (count == null) {
                    continue;
                }
                final double termFrequency = (double) count / sectionLength;
                score += termFrequency * index.idf().getOrDefault(term, DEFAULT_IDF);
                matched.add(term);
            }

            if (!matched.isEmpty()) {
                results.add(new SearchResult(section.file(), section.header(), section.hierarchy(), score,
                        matched, section.lineStart(), section.lineEnd(),
                        TextCleaner.preview(section.content(), previewChars)));
            }
        }

        // List.sort is stable
        results.sort(Comparator.comparingDouble(SearchResult::score).reversed());

        logger.debug("Query '{}' matched {} sections, returning at most {}", query, results.size(), topN);
        return List.copyOf(results.subList(0, Math.min(topN, results.size())));
    }

    private static Map<String, Integer> termCounts(final List<String> tokens) {
        final Map<String, Integer> counts = new HashMap<>();
        for (final String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        return counts;
    }
}
