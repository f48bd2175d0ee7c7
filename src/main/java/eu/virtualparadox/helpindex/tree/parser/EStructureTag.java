package eu.virtualparadox.helpindex.tree.parser;

import eu.virtualparadox.helpindex.tree.model.ENodeKind;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Element vocabulary of the structure document. Every element has a long and an
 * abbreviated spelling; both resolve to the same constant.
 */
public enum EStructureTag {
    SECTION("Section", "S"),
    PAGE("Page", "P"),
    IDENTIFIERS("Identifiers", "I"),
    HELP_ID("HelpID", "H"),
    OTHER("", "");

    private static final Map<String, EStructureTag> BY_SPELLING = new HashMap<>();

    static {
        for (final EStructureTag tag : values()) {
            if (tag != OTHER) {
                BY_SPELLING.put(tag.longName, tag);
                BY_SPELLING.put(tag.shortName, tag);
                BY_SPELLING.put(tag.longName.toLowerCase(Locale.ROOT), tag);
            }
        }
    }

    private final String longName;
    private final String shortName;

    EStructureTag(final String longName, final String shortName) {
        this.longName = longName;
        this.shortName = shortName;
    }

    /**
     * Resolves an element name. Long spellings match case-insensitively, abbreviations exactly.
     * Unknown names resolve to {@link #OTHER}.
     */
    public static EStructureTag of(final String localName) {
        final EStructureTag exact = BY_SPELLING.get(localName);
        if (exact != null) {
            return exact;
        }
        return BY_SPELLING.getOrDefault(localName.toLowerCase(Locale.ROOT), OTHER);
    }

    public boolean isNode() {
        return this == SECTION || this == PAGE;
    }

    public ENodeKind nodeKind() {
        return this == SECTION ? ENodeKind.SECTION : ENodeKind.PAGE;
    }
}
