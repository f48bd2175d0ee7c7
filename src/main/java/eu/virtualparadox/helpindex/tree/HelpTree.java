package eu.virtualparadox.helpindex.tree;

import eu.virtualparadox.helpindex.tree.model.ENodeKind;
import eu.virtualparadox.helpindex.tree.model.HelpNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable-after-build node table of the help corpus.
 * <p>Provides identity and stable-identifier lookups. A stable identifier may be shared by
 * several nodes; all of them are retained in document order and single lookups return the
 * first one.</p>
 * <p>Safe for concurrent readers without synchronization.</p>
 */
public final class HelpTree {

    private final Map<String, HelpNode> nodes;
    private final List<String> rootIds;
    private final Map<String, List<String>> helpIdIndex;
    private final String sourceFingerprint;
    private final long sourceSizeBytes;
    private final int pageCount;

    HelpTree(final Map<String, HelpNode> nodes, final String sourceFingerprint, final long sourceSizeBytes) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.sourceFingerprint = sourceFingerprint;
        this.sourceSizeBytes = sourceSizeBytes;

        final List<String> roots = new ArrayList<>();
        final Map<String, List<String>> byHelpId = new LinkedHashMap<>();
        int pages = 0;
        for (final HelpNode node : nodes.values()) {
            if (node.isRoot()) {
                roots.add(node.getId());
            }
            if (node.getKind() == ENodeKind.PAGE) {
                pages++;
            }
            for (final String helpId : node.getHelpIds()) {
                byHelpId.computeIfAbsent(helpId, k -> new ArrayList<>()).add(node.getId());
            }
        }
        byHelpId.replaceAll((k, v) -> List.copyOf(v));

        this.rootIds = List.copyOf(roots);
        this.helpIdIndex = Collections.unmodifiableMap(byHelpId);
        this.pageCount = pages;
    }

    public static HelpTreeBuilder builder() {
        return new HelpTreeBuilder();
    }

    public Optional<HelpNode> getNode(final String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(nodes.get(id));
    }

    /**
     * @return all nodes in document order
     */
    public Collection<HelpNode> nodes() {
        return nodes.values();
    }

    public List<HelpNode> roots() {
        return rootIds.stream().map(nodes::get).toList();
    }

    public List<HelpNode> children(final HelpNode node) {
        return node.getChildIds().stream().map(nodes::get).toList();
    }

    public Optional<HelpNode> parent(final HelpNode node) {
        return getNode(node.getParentId());
    }

    /**
     * Looks up the first node, in document order, carrying the stable identifier.
     */
    public Optional<HelpNode> findByHelpId(final String helpId) {
        return findAllByHelpId(helpId).stream().findFirst();
    }

    public List<HelpNode> findAllByHelpId(final String helpId) {
        if (helpId == null) {
            return List.of();
        }
        return helpIdIndex.getOrDefault(helpId.trim(), List.of()).stream().map(nodes::get).toList();
    }

    public int size() {
        return nodes.size();
    }

    public int pageCount() {
        return pageCount;
    }

    public int sectionCount() {
        return nodes.size() - pageCount;
    }

    public int helpIdCount() {
        return helpIdIndex.size();
    }

    /**
     * @return fingerprint of the exact bytes this tree was parsed from, empty for synthetic trees
     */
    public String getSourceFingerprint() {
        return sourceFingerprint;
    }

    public long getSourceSizeBytes() {
        return sourceSizeBytes;
    }
}
