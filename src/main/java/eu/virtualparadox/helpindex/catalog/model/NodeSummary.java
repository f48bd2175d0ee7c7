package eu.virtualparadox.helpindex.catalog.model;

/**
 * @param id         node identity
 * @param title      node title
 * @param kind       {@code SECTION} or {@code PAGE}
 * @param childCount number of direct children
 * @param helpId     first stable identifier, {@code null} when none
 */
public record NodeSummary(String id, String title, String kind, int childCount, String helpId) {

    public boolean isSection() {
        return "SECTION".equals(kind);
    }
}
