package eu.virtualparadox.helpindex.tree.ancestry;

import eu.virtualparadox.helpindex.tree.HelpTree;
import eu.virtualparadox.helpindex.tree.model.BreadcrumbEntry;
import eu.virtualparadox.helpindex.tree.model.HelpNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Computes root-to-node paths by walking parent ids.
 *
 * <h2>Guards</h2>
 * <ul>
 *   <li><b>Depth:</b> at most {@link #MAX_DEPTH} entries are collected. A longer chain yields the
 *       {@code MAX_DEPTH} nearest ancestors, ending at the node.</li>
 *   <li><b>Cycles:</b> the walk stops before the first node it has already visited and returns
 *       what it collected so far.</li>
 * </ul>
 * Both cases are logged and never raised. The resolver only reads the tree and keeps no state,
 * so it is safe for any number of concurrent callers.
 */
@Slf4j
public final class AncestryResolver {

    public static final int MAX_DEPTH = 100;
    public static final String SEPARATOR = " > ";

    private final HelpTree tree;

    public AncestryResolver(final HelpTree tree) {
        this.tree = tree;
    }

    /**
     * @param nodeId node identity
     * @return root-to-node entries, inclusive; empty when the node is unknown
     */
    public List<BreadcrumbEntry> breadcrumb(final String nodeId) {
        final Optional<HelpNode> start = tree.getNode(nodeId);
        if (start.isEmpty()) {
            return List.of();
        }

        final Deque<BreadcrumbEntry> path = new ArrayDeque<>();
        final Set<String> visited = new HashSet<>();
        HelpNode current = start.get();

        while (current != null) {
            if (!visited.add(current.getId())) {
                log.warn("Parent cycle detected at {} while resolving breadcrumb of {}", current.getId(), nodeId);
                break;
            }
            if (path.size() >= MAX_DEPTH) {
                log.warn("Breadcrumb of {} exceeds depth {}, truncated", nodeId, MAX_DEPTH);
                break;
            }
            path.addFirst(new BreadcrumbEntry(current.getId(), current.getTitle()));
            current = tree.parent(current).orElse(null);
        }

        return List.copyOf(path);
    }

    /**
     * @return breadcrumb titles joined with {@value #SEPARATOR}
     */
    public String breadcrumbString(final String nodeId) {
        return String.join(SEPARATOR, breadcrumb(nodeId).stream().map(BreadcrumbEntry::title).toList());
    }

    /**
     * The category of a node is the title of the first breadcrumb entry.
     *
     * @return category title, empty when the node is unknown
     */
    public Optional<String> category(final String nodeId) {
        final List<BreadcrumbEntry> path = breadcrumb(nodeId);
        return path.isEmpty() ? Optional.empty() : Optional.of(path.get(0).title());
    }

    /**
     * @return number of breadcrumb entries, 0 when the node is unknown
     */
    public int depth(final String nodeId) {
        return breadcrumb(nodeId).size();
    }
}
