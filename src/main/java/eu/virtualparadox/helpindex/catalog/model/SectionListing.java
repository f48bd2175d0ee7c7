package eu.virtualparadox.helpindex.catalog.model;

import java.util.List;

/**
 * A node with its direct children, in document order.
 */
public record SectionListing(NodeSummary section, List<NodeSummary> children) {

    public int total() {
        return children.size();
    }
}
