package eu.virtualparadox.helpindex.query;

import eu.virtualparadox.helpindex.util.LuceneConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.queryparser.classic.QueryParserBase;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns free text into query-parser input that cannot carry query syntax.
 * <ul>
 *   <li>Tokens without any letter or digit are dropped.</li>
 *   <li>Parser operators ({@code AND}, {@code OR}, {@code NOT}) are lower-cased into plain words.</li>
 *   <li>All syntax characters are backslash-escaped.</li>
 *   <li>With prefix matching, {@value #PREFIX_MARKER} is appended to the last token when it
 *       ends in a letter or digit and the analyzer keeps it as a single term. Prefix queries
 *       are not analyzed, so {@code i/o*} or {@code e-mail*} would never match.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuerySanitizer {

    public static final char PREFIX_MARKER = '*';

    private static final Set<String> OPERATORS = Set.of("AND", "OR", "NOT");

    private final Analyzer analyzer;

    /**
     * @param raw         user input, may be {@code null}
     * @param prefixMatch append the prefix marker to the final token
     * @return escaped query text, empty when nothing searchable remains
     */
    public Optional<String> sanitize(final String raw, final boolean prefixMatch) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        final List<String> tokens = new ArrayList<>();
        for (final String token : raw.trim().split("\\s+")) {
            if (token.codePoints().anyMatch(Character::isLetterOrDigit)) {
                tokens.add(token);
            }
        }
        if (tokens.isEmpty()) {
            return Optional.empty();
        }

        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            final String token = tokens.get(i);
            final String word = OPERATORS.contains(token) ? token.toLowerCase(Locale.ROOT) : token;
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(QueryParserBase.escape(word));
            if (prefixMatch && i == tokens.size() - 1 && endsWithLetterOrDigit(word)
                    && isSingleTerm(word)) {
                sb.append(PREFIX_MARKER);
            }
        }
        return Optional.of(sb.toString());
    }

    private boolean isSingleTerm(final String word) {
        int terms = 0;
        try (TokenStream stream = analyzer.tokenStream(LuceneConstants.FIELD_BODY, word)) {
            stream.reset();
            while (stream.incrementToken()) {
                terms++;
            }
            stream.end();
        } catch (IOException e) {
            log.warn("Unable to analyze query token '{}', prefix matching disabled for it", word, e);
            return false;
        }
        return terms == 1;
    }

    private static boolean endsWithLetterOrDigit(final String token) {
        return Character.isLetterOrDigit(token.codePointBefore(token.length()));
    }
}
