package eu.virtualparadox.helpindex.tree.model;

/**
 * One step of a root-to-node path.
 *
 * @param id    node identity
 * @param title node display title
 */
public record BreadcrumbEntry(String id, String title) {

}
