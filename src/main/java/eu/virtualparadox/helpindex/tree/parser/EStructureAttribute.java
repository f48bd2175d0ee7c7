package eu.virtualparadox.helpindex.tree.parser;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Attribute vocabulary of the structure document, long and abbreviated spellings.
 */
public enum EStructureAttribute {
    ID("Id", "id"),
    TITLE("Text", "t"),
    FILE("File", "p"),
    VALUE("Value", "v");

    private static final Map<String, EStructureAttribute> BY_SPELLING = new HashMap<>();

    static {
        for (final EStructureAttribute attribute : values()) {
            BY_SPELLING.put(attribute.longName, attribute);
            BY_SPELLING.put(attribute.shortName, attribute);
            BY_SPELLING.put(attribute.longName.toLowerCase(Locale.ROOT), attribute);
        }
    }

    private final String longName;
    private final String shortName;

    EStructureAttribute(final String longName, final String shortName) {
        this.longName = longName;
        this.shortName = shortName;
    }

    public static Optional<EStructureAttribute> of(final String localName) {
        final EStructureAttribute exact = BY_SPELLING.get(localName);
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(BY_SPELLING.get(localName.toLowerCase(Locale.ROOT)));
    }
}
