package eu.virtualparadox.helpindex.tree.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * One structural unit of the help corpus, either a section or a page.
 * <p>Links to parent and children are node ids resolved through the owning
 * {@link eu.virtualparadox.helpindex.tree.HelpTree}, never object references.
 * Everything except the extracted-text cache is fixed at construction.</p>
 */
@Getter
public final class HelpNode {

    private final String id;
    private final String title;
    /** Content file path relative to the corpus root, {@code null} when the node names none. */
    private final String file;
    private final ENodeKind kind;
    private final List<String> helpIds;
    /** Parent node id, {@code null} for roots. */
    private final String parentId;
    private final List<String> childIds;

    @Getter(AccessLevel.NONE)
    private volatile String extractedText;

    public HelpNode(final String id,
                    final String title,
                    final String file,
                    final ENodeKind kind,
                    final List<String> helpIds,
                    final String parentId,
                    final List<String> childIds) {
        this.id = id;
        this.title = title == null ? "" : title;
        this.file = file;
        this.kind = kind;
        this.helpIds = List.copyOf(helpIds);
        this.parentId = parentId;
        this.childIds = List.copyOf(childIds);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean isSection() {
        return kind == ENodeKind.SECTION;
    }

    public boolean hasFile() {
        return file != null && !file.isBlank();
    }

    /**
     * @return the first stable identifier, if any
     */
    public Optional<String> primaryHelpId() {
        return helpIds.isEmpty() ? Optional.empty() : Optional.of(helpIds.get(0));
    }

    public Optional<String> cachedText() {
        return Optional.ofNullable(extractedText);
    }

    /**
     * Stores the extracted text. Extraction is deterministic, so concurrent
     * writers store equal values and the last write wins.
     */
    public void cacheText(final String text) {
        this.extractedText = text;
    }

    @Override
    public String toString() {
        return kind + "[" + id + ", '" + title + "']";
    }
}
