package de.mirkosertic.mcp.docnav;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.pattern.PatternTokenizer;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Analyzer producing the index terms of the navigator.
 *
 * Token chain:
 * - PatternTokenizer: maximal runs of an ASCII letter followed by letters, digits or underscores
 * - StopFilter: fixed English function-word list
 * - LengthFilter: terms shorter than three characters are dropped
 *
 * The pattern only accepts lowercase letters, so input has to be lower-cased before it
 * reaches this analyzer. {@link TermTokenizer} takes care of that.
 */
public class TermAnalyzer extends Analyzer {

    static final Pattern TERM_PATTERN = Pattern.compile("[a-z][a-z0-9_]+");

    static final int MIN_TERM_LENGTH = 3;

    static final List<String> STOPWORDS = List.of(
            "a", "about", "above", "after", "again", "all", "also", "an", "and", "any",
            "are", "as", "at", "be", "been", "before", "being", "below", "between", "both",
            "but", "by", "can", "could", "did", "do", "does", "doing", "down", "during",
            "each", "few", "for", "from", "further", "had", "has", "have", "having", "he",
            "her", "here", "hers", "him", "his", "how", "if", "in", "into", "is",
            "it", "its", "just", "may", "more", "most", "must", "no", "nor", "not",
            "of", "off", "on", "only", "or", "other", "our", "out", "over", "own",
            "same", "she", "should", "so", "some", "such", "than", "that", "the", "their",
            "them", "then", "there", "these", "they", "this", "those", "through", "to", "too",
            "under", "until", "up", "very", "was", "we", "were", "what", "when", "where",
            "which", "while", "who", "whom", "why", "will", "with", "would", "you", "your"
    );

    private static final CharArraySet STOPWORD_SET = CharArraySet.unmodifiableSet(new CharArraySet(STOPWORDS, false));

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new PatternTokenizer(TERM_PATTERN, 0);
        TokenStream stream = new StopFilter(tokenizer, STOPWORD_SET);
        stream = new LengthFilter(stream, MIN_TERM_LENGTH, Integer.MAX_VALUE);
        return new TokenStreamComponents(tokenizer, stream);
    }
}
