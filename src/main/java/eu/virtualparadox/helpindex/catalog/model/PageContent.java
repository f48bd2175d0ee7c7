package eu.virtualparadox.helpindex.catalog.model;

import java.util.List;

/**
 * Full view of one node.
 *
 * @param pageId        node identity
 * @param title         node title
 * @param kind          {@code SECTION} or {@code PAGE}
 * @param helpIds       stable identifiers, possibly empty
 * @param breadcrumb    titles from the root down to this node, inclusive
 * @param plainText     extracted text of the content file, empty when unavailable
 * @param file          content file relative to the corpus root, {@code null} when absent
 * @param onlineHelpUrl online location of the page, {@code null} when not configured
 */
public record PageContent(String pageId,
                          String title,
                          String kind,
                          List<String> helpIds,
                          List<String> breadcrumb,
                          String plainText,
                          String file,
                          String onlineHelpUrl) {

    public String breadcrumbPath() {
        return String.join(" > ", breadcrumb);
    }
}
