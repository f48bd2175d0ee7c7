package eu.virtualparadox.helpindex.query.model;

import java.util.List;

/**
 * One page of ranked results.
 *
 * @param offset applied offset
 * @param limit  applied page size
 * @param total  number of matching documents across all pages
 * @param hits   results of this page, best first
 */
public record SearchPage(int offset, int limit, long total, List<SearchHit> hits) {

    public static SearchPage empty(final int offset, final int limit) {
        return new SearchPage(offset, limit, 0, List.of());
    }

    public boolean hasMore() {
        return offset + hits.size() < total;
    }
}
