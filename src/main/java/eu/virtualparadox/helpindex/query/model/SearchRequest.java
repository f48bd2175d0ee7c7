package eu.virtualparadox.helpindex.query.model;

/**
 * @param query       free text as typed by the user
 * @param offset      number of ranked results to skip
 * @param limit       page size
 * @param prefixMatch treat the last word as a prefix
 * @param category    top-level section title to restrict results to, {@code null} for all
 */
public record SearchRequest(String query, int offset, int limit, boolean prefixMatch, String category) {

    public static SearchRequest of(final String query, final int offset, final int limit) {
        return new SearchRequest(query, offset, limit, true, null);
    }

    public SearchRequest withCategory(final String category) {
        return new SearchRequest(query, offset, limit, prefixMatch, category);
    }

    public SearchRequest withPrefixMatch(final boolean prefixMatch) {
        return new SearchRequest(query, offset, limit, prefixMatch, category);
    }
}
