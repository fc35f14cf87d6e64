package de.mirkosertic.mcp.docnav;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns free text into the ordered term sequence used for indexing and querying.
 * <p>
 * Duplicates are kept in order of occurrence; frequencies are derived from this multiset
 * by the index builder and the search engine.
 */
public final class TermTokenizer {

    private static final String FIELD = "content";

    private static final Analyzer ANALYZER = new TermAnalyzer();

    private TermTokenizer() {
    }

    /**
     * @param text raw text, may be null
     * @return the terms of the text, empty for null, blank or term-free input
     */
    public static List<String> tokenize(final @Nullable String text) {
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }

        final List<String> terms = new ArrayList<>();
        try (final TokenStream stream = ANALYZER.tokenStream(FIELD, text.toLowerCase(Locale.ROOT))) {
            final CharTermAttribute termAttr = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                terms.add(termAttr.toString());
            }
            stream.end();
        } catch (final IOException e) {
            // Only reachable through a broken analysis chain, the input is an in-memory string
            throw new UncheckedIOException("Failed to tokenize text", e);
        }
        return terms;
    }
}
