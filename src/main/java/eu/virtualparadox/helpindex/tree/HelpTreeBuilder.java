package eu.virtualparadox.helpindex.tree;

import eu.virtualparadox.helpindex.tree.model.ENodeKind;
import eu.virtualparadox.helpindex.tree.model.HelpNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects nodes with explicit parent ids and freezes them into a {@link HelpTree}.
 * <p>Nodes keep insertion order. Missing ids are assigned sequentially, duplicate ids get a
 * numeric suffix, and parent ids that name no node turn the child into a root.</p>
 * <p>Not thread-safe; used by a single parsing thread.</p>
 */
@Slf4j
public final class HelpTreeBuilder {

    private static final String GENERATED_ID_PREFIX = "node-";

    private final Map<String, Draft> drafts = new LinkedHashMap<>();
    private int sequence;
    private String sourceFingerprint = "";
    private long sourceSizeBytes;

    /**
     * Registers a node.
     *
     * @param requestedId id from the source, may be {@code null} or blank
     * @param title       display title, may be {@code null}
     * @param file        content file relative to the root, may be {@code null}
     * @param kind        section or page
     * @param parentId    parent node id, {@code null} for roots
     * @return the id actually assigned to the node
     */
    public String add(final String requestedId,
                      final String title,
                      final String file,
                      final ENodeKind kind,
                      final String parentId) {
        final String id = assignId(requestedId);
        drafts.put(id, new Draft(id, title, blankToNull(file), kind, parentId));
        return id;
    }

    /**
     * Attaches a stable identifier to an already registered node.
     */
    public void addHelpId(final String nodeId, final String helpId) {
        final Draft draft = drafts.get(nodeId);
        if (draft == null) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        if (helpId != null && !helpId.isBlank()) {
            draft.helpIds.add(helpId.trim());
        }
    }

    public Optional<ENodeKind> kindOf(final String nodeId) {
        final Draft draft = drafts.get(nodeId);
        return draft == null ? Optional.empty() : Optional.of(draft.kind);
    }

    public HelpTreeBuilder source(final String fingerprint, final long sizeBytes) {
        this.sourceFingerprint = fingerprint;
        this.sourceSizeBytes = sizeBytes;
        return this;
    }

    public HelpTree build() {
        final Map<String, List<String>> children = new LinkedHashMap<>();
        for (final Draft draft : drafts.values()) {
            if (draft.parentId != null && !drafts.containsKey(draft.parentId)) {
                log.warn("Node {} references unknown parent {}, treating it as a root", draft.id, draft.parentId);
                draft.parentId = null;
            }
            if (draft.parentId != null) {
                children.computeIfAbsent(draft.parentId, k -> new ArrayList<>()).add(draft.id);
            }
        }

        final Map<String, HelpNode> nodes = new LinkedHashMap<>();
        for (final Draft draft : drafts.values()) {
            nodes.put(draft.id, new HelpNode(
                    draft.id,
                    draft.title,
                    draft.file,
                    draft.kind,
                    draft.helpIds,
                    draft.parentId,
                    children.getOrDefault(draft.id, List.of())));
        }
        return new HelpTree(nodes, sourceFingerprint, sourceSizeBytes);
    }

    private String assignId(final String requestedId) {
        if (requestedId == null || requestedId.isBlank()) {
            String generated;
            do {
                generated = GENERATED_ID_PREFIX + (++sequence);
            } while (drafts.containsKey(generated));
            return generated;
        }

        final String id = requestedId.trim();
        if (!drafts.containsKey(id)) {
            return id;
        }

        int suffix = 2;
        while (drafts.containsKey(id + "~" + suffix)) {
            suffix++;
        }
        log.warn("Duplicate node id {}, registering it as {}", id, id + "~" + suffix);
        return id + "~" + suffix;
    }

    private static String blankToNull(final String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static final class Draft {
        private final String id;
        private final String title;
        private final String file;
        private final ENodeKind kind;
        private final List<String> helpIds = new ArrayList<>();
        private String parentId;

        private Draft(final String id, final String title, final String file, final ENodeKind kind, final String parentId) {
            this.id = id;
            this.title = title;
            this.file = file;
            this.kind = kind;
            this.parentId = parentId;
        }
    }
}
