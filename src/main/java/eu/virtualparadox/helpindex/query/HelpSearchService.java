package eu.virtualparadox.helpindex.query;

import eu.virtualparadox.helpindex.application.config.ApplicationConfig;
import eu.virtualparadox.helpindex.index.HelpIndexManager;
import eu.virtualparadox.helpindex.query.model.SearchHit;
import eu.virtualparadox.helpindex.query.model.SearchPage;
import eu.virtualparadox.helpindex.query.model.SearchRequest;
import eu.virtualparadox.helpindex.tree.HelpTree;
import eu.virtualparadox.helpindex.tree.model.HelpNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static eu.virtualparadox.helpindex.util.LuceneConstants.*;

/**
 * Ranked, paginated keyword search over the active index.
 * <p>
 * Steps:
 * <ol>
 *   <li>Sanitize the user text with {@link QuerySanitizer}</li>
 *   <li>Parse it against title and body, title boosted {@value eu.virtualparadox.helpindex.util.LuceneConstants#TITLE_BOOST}x,
 *       all words required</li>
 *   <li>Optionally restrict to one category</li>
 *   <li>Count all matches and materialize the requested page, titles refreshed from the tree</li>
 * </ol>
 * Input that sanitizes to nothing, fails to parse or fails to execute yields an empty page.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HelpSearchService {

    private static final int PREVIEW_CHARS = 200;

    private final HelpIndexManager indexManager;
    private final Analyzer analyzer;
    private final QuerySanitizer sanitizer;
    private final HelpTree tree;
    private final ApplicationConfig props;

    public SearchPage search(final String query, final int offset, final int limit) {
        return search(SearchRequest.of(query, offset, limit));
    }

    /**
     * Executes a search.
     *
     * @param request query, paging and filter
     * @return requested page with the total match count, never {@code null}
     */
    public SearchPage search(final SearchRequest request) {
        final int offset = Math.max(0, request.offset());
        final int limit = clampLimit(request.limit());

        final Optional<String> sanitized = sanitizer.sanitize(request.query(), request.prefixMatch());
        if (sanitized.isEmpty()) {
            return SearchPage.empty(offset, limit);
        }

        final Query query;
        try {
            query = buildQuery(sanitized.get(), request.category());
        } catch (ParseException e) {
            log.debug("Unparseable query '{}' treated as no match", request.query(), e);
            return SearchPage.empty(offset, limit);
        }

        try {
            return indexManager.withSearcher(searcher -> execute(searcher, query, offset, limit));
        } catch (final Exception e) {
            log.error("Search failed for query: {}", request.query(), e);
            return SearchPage.empty(offset, limit);
        }
    }

    private Query buildQuery(final String text, final String category) throws ParseException {
        final Query textQuery = new WeightedQueryParser(analyzer).parse(text);

        if (category == null || category.isBlank()) {
            return textQuery;
        }
        return new BooleanQuery.Builder()
                .add(textQuery, BooleanClause.Occur.MUST)
                .add(new TermQuery(new Term(FIELD_CATEGORY, category.trim())), BooleanClause.Occur.FILTER)
                .build();
    }

    private SearchPage execute(final IndexSearcher searcher,
                               final Query query,
                               final int offset,
                               final int limit) throws IOException {
        final int total = searcher.count(query);
        if (offset >= total) {
            return new SearchPage(offset, limit, total, List.of());
        }

        final TopDocs top = searcher.search(query, offset + limit);
        final StoredFields storedFields = searcher.storedFields();
        final List<SearchHit> hits = new ArrayList<>(limit);
        for (int i = offset; i < top.scoreDocs.length; i++) {
            final ScoreDoc sd = top.scoreDocs[i];
            hits.add(toSearchHit(storedFields.document(sd.doc), sd.score));
        }
        return new SearchPage(offset, limit, total, List.copyOf(hits));
    }

    /**
     * Converts a stored document to a hit. The title comes from the tree when the node is
     * known, so results always agree with tree lookups.
     */
    private SearchHit toSearchHit(final Document doc, final float score) {
        final String pageId = doc.get(FIELD_PAGE_ID);
        final String title = tree.getNode(pageId).map(HelpNode::getTitle).orElse(doc.get(FIELD_TITLE));
        final String category = doc.get(FIELD_CATEGORY);

        return new SearchHit(
                pageId,
                title,
                doc.get(FIELD_BREADCRUMB),
                category == null ? "" : category,
                doc.get(FIELD_HELP_ID),
                doc.get(FIELD_KIND),
                doc.get(FIELD_FILE),
                preview(doc.get(FIELD_BODY)),
                score);
    }

    private int clampLimit(final int limit) {
        if (limit <= 0) {
            return Math.min(props.getDefaultPageSize(), props.getMaxPageSize());
        }
        return Math.min(limit, props.getMaxPageSize());
    }

    private static String preview(final String body) {
        if (body == null || body.length() <= PREVIEW_CHARS) {
            return body == null ? "" : body;
        }
        final int cut = body.lastIndexOf(' ', PREVIEW_CHARS);
        return body.substring(0, cut > 0 ? cut : PREVIEW_CHARS) + "...";
    }

    /**
     * Title/body parser requiring all words. {@link MultiFieldQueryParser} boosts plain terms
     * only; prefix and wildcard terms get the same field boosts here.
     */
    private static final class WeightedQueryParser extends MultiFieldQueryParser {

        private WeightedQueryParser(final Analyzer analyzer) {
            super(new String[]{FIELD_TITLE, FIELD_BODY}, analyzer, SEARCH_FIELD_BOOSTS);
            setDefaultOperator(QueryParser.Operator.AND);
        }

        @Override
        protected Query getPrefixQuery(final String field, final String termStr) throws ParseException {
            return boost(field, super.getPrefixQuery(field, termStr));
        }

        @Override
        protected Query getWildcardQuery(final String field, final String termStr) throws ParseException {
            return boost(field, super.getWildcardQuery(field, termStr));
        }

        // field == null means the per-field queries were already built, and boosted, through this parser
        private static Query boost(final String field, final Query query) {
            if (field == null || query == null) {
                return query;
            }
            final Float weight = SEARCH_FIELD_BOOSTS.get(field);
            return weight == null || weight == 1.0f ? query : new BoostQuery(query, weight);
        }
    }
}
