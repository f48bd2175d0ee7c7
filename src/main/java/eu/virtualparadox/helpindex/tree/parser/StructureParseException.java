package eu.virtualparadox.helpindex.tree.parser;

import lombok.Getter;

/**
 * Unrecoverable failure to read the structure document: unreadable file or malformed XML.
 * Line and column are {@code -1} when no location is known.
 */
@Getter
public class StructureParseException extends RuntimeException {

    private final String source;
    private final int line;
    private final int column;

    public StructureParseException(final String message,
                                   final String source,
                                   final int line,
                                   final int column,
                                   final Throwable cause) {
        super(format(message, source, line, column), cause);
        this.source = source;
        this.line = line;
        this.column = column;
    }

    private static String format(final String message, final String source, final int line, final int column) {
        if (line < 0) {
            return message + " [" + source + "]";
        }
        return message + " [" + source + " at line " + line + ", column " + column + "]";
    }
}
