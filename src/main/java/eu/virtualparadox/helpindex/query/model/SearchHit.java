package eu.virtualparadox.helpindex.query.model;

/**
 * @param pageId     node identity
 * @param title      node title
 * @param breadcrumb breadcrumb titles joined with {@code " > "}
 * @param category   title of the top-level section, empty when unknown
 * @param helpId     first stable identifier, {@code null} when the node has none
 * @param kind       {@code SECTION} or {@code PAGE}
 * @param file       content file relative to the corpus root, {@code null} when absent
 * @param preview    leading part of the extracted text
 * @param score      ranking score (higher = better)
 */
public record SearchHit(String pageId,
                        String title,
                        String breadcrumb,
                        String category,
                        String helpId,
                        String kind,
                        String file,
                        String preview,
                        float score) {

}
