package net.chapterone.service.similarity;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

/**
 * Splits text with Lucene's {@link StandardAnalyzer} (Unicode word boundaries, lower-casing, English stop
 * words plus a few catalog-specific ones) and keeps tokens of three or more characters.
 */
public final class TextTokenizer {

    static final int MIN_TOKEN_LENGTH = 3;

    private static final String FIELD = "description";

    private static final Set<String> CATALOG_STOP_WORDS = Set.of(
        "from", "were", "you", "your", "his", "her", "its", "them", "than", "has", "have", "had",
        "who", "what", "when", "where", "which", "would", "about", "all", "can", "our", "one", "out",
        "also", "more", "most", "some", "over"
    );

    private static final Analyzer ANALYZER = new StandardAnalyzer(stopWords());

    private TextTokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        List<String> tokens = new ArrayList<>();
        try (TokenStream stream = ANALYZER.tokenStream(FIELD, text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                if (term.length() >= MIN_TOKEN_LENGTH) {
                    tokens.add(term.toString());
                }
            }
            stream.end();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to tokenize text", ex);
        }
        return tokens;
    }

    private static CharArraySet stopWords() {
        CharArraySet stopWords = new CharArraySet(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET, true);
        stopWords.addAll(CATALOG_STOP_WORDS);
        return CharArraySet.unmodifiableSet(stopWords);
    }
}
