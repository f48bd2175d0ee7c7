package eu.virtualparadox.helpindex.util;

import java.util.Map;

public class LuceneConstants {
    public static final String FIELD_PAGE_ID = "pageId";
    public static final String FIELD_TITLE = "title";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_BREADCRUMB = "breadcrumb";
    public static final String FIELD_CATEGORY = "category";
    public static final String FIELD_HELP_ID = "helpId";
    public static final String FIELD_KIND = "kind";
    public static final String FIELD_FILE = "file";

    public static final float TITLE_BOOST = 10.0f;
    public static final float BODY_BOOST = 1.0f;

    /** Fields matched by free-text queries, with their boosts. */
    public static final Map<String, Float> SEARCH_FIELD_BOOSTS = Map.of(
            FIELD_TITLE, TITLE_BOOST,
            FIELD_BODY, BODY_BOOST);

    /**
     * Fingerprint of the document layout and analysis chain. Any change to the fields,
     * their indexing options or the analyzer must change this string.
     */
    public static final String SCHEMA_VERSION = Fingerprints.sha256(String.join(";",
            "schema=3",
            "analyzer=StandardAnalyzer",
            FIELD_PAGE_ID + "=string,stored",
            FIELD_TITLE + "=text,stored",
            FIELD_BODY + "=text,stored",
            FIELD_BREADCRUMB + "=stored",
            FIELD_CATEGORY + "=string,stored",
            FIELD_HELP_ID + "=string,stored,multi",
            FIELD_KIND + "=string,stored",
            FIELD_FILE + "=stored"));

    private LuceneConstants() {
        // prevent instantiation
    }
}
