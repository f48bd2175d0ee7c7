package eu.virtualparadox.helpindex.tree.parser;

import eu.virtualparadox.helpindex.tree.HelpTree;
import eu.virtualparadox.helpindex.tree.HelpTreeBuilder;
import eu.virtualparadox.helpindex.tree.model.ENodeKind;
import eu.virtualparadox.helpindex.util.Fingerprints;
import lombok.extern.slf4j.Slf4j;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Streams the structure document into a {@link HelpTree}.
 *
 * <h2>Tolerance</h2>
 * <ul>
 *   <li>Long and abbreviated spellings of elements and attributes are equivalent
 *       (see {@link EStructureTag}, {@link EStructureAttribute}).</li>
 *   <li>Title, content file and identifiers are optional on every node.</li>
 *   <li>Unknown elements are transparent: their node descendants attach to the enclosing node.</li>
 *   <li>A section or page nested inside a page is attached to the nearest enclosing section,
 *       or becomes a root when there is none.</li>
 * </ul>
 * Only XML syntax errors and unreadable input raise {@link StructureParseException}.
 *
 * <p>The tree records the fingerprint of the exact bytes it was parsed from.</p>
 */
@Slf4j
public class StructureParser {

    private final XMLInputFactory inputFactory;

    public StructureParser() {
        this.inputFactory = XMLInputFactory.newFactory();
        this.inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        this.inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    }

    /**
     * Parses the structure document at {@code source}.
     *
     * @param source structure document path
     * @return parsed tree
     * @throws StructureParseException if the file cannot be read or is not well-formed XML
     */
    public HelpTree parse(final Path source) {
        final byte[] bytes;
        try {
            bytes = Files.readAllBytes(source);
        } catch (IOException e) {
            throw new StructureParseException("Cannot read structure document", source.toString(), -1, -1, e);
        }
        return parse(bytes, source.toString());
    }

    /**
     * Parses an in-memory structure document.
     *
     * @param bytes      document bytes
     * @param sourceName name used in error messages
     * @return parsed tree
     */
    public HelpTree parse(final byte[] bytes, final String sourceName) {
        final HelpTreeBuilder builder = HelpTree.builder().source(Fingerprints.sha256(bytes), bytes.length);

        XMLStreamReader reader = null;
        try {
            reader = inputFactory.createXMLStreamReader(new ByteArrayInputStream(bytes));
            final Deque<Frame> open = new ArrayDeque<>();
            while (reader.hasNext()) {
                final int event = reader.next();
                if (event == XMLStreamConstants.START_ELEMENT) {
                    open.push(startElement(reader, open, builder));
                } else if (event == XMLStreamConstants.END_ELEMENT) {
                    open.pop();
                }
            }
        } catch (XMLStreamException e) {
            final Location location = e.getLocation();
            final int line = location == null ? -1 : location.getLineNumber();
            final int column = location == null ? -1 : location.getColumnNumber();
            throw new StructureParseException("Malformed structure document: " + e.getMessage(),
                    sourceName, line, column, e);
        } finally {
            closeQuietly(reader, sourceName);
        }

        return builder.build();
    }

    private Frame startElement(final XMLStreamReader reader,
                               final Deque<Frame> open,
                               final HelpTreeBuilder builder) {
        final EStructureTag tag = EStructureTag.of(reader.getLocalName());

        if (tag.isNode()) {
            final Map<EStructureAttribute, String> attributes = attributes(reader);
            final String parentId = resolveParent(reader, open, builder, tag);
            final String id = builder.add(
                    attributes.get(EStructureAttribute.ID),
                    attributes.get(EStructureAttribute.TITLE),
                    attributes.get(EStructureAttribute.FILE),
                    tag.nodeKind(),
                    parentId);
            return new Frame(tag, id);
        }

        if (tag == EStructureTag.HELP_ID) {
            final String owner = nearestNode(open);
            final String value = attributes(reader).get(EStructureAttribute.VALUE);
            if (owner == null) {
                log.warn("Identifier {} outside any node at line {}, ignored", value, lineOf(reader));
            } else {
                builder.addHelpId(owner, value);
            }
        }
        return new Frame(tag, null);
    }

    /**
     * Finds the node a new section or page belongs to. Pages cannot own children, so a node
     * nested in a page is handed to the nearest enclosing section.
     */
    private String resolveParent(final XMLStreamReader reader,
                                 final Deque<Frame> open,
                                 final HelpTreeBuilder builder,
                                 final EStructureTag tag) {
        final String enclosing = nearestNode(open);
        if (enclosing == null || builder.kindOf(enclosing).orElse(ENodeKind.SECTION) == ENodeKind.SECTION) {
            return enclosing;
        }

        String adopter = null;
        for (final Frame frame : open) {
            if (frame.tag() == EStructureTag.SECTION) {
                adopter = frame.nodeId();
                break;
            }
        }
        log.warn("{} nested in page {} at line {}, attaching it to {}",
                tag, enclosing, lineOf(reader), adopter == null ? "the top level" : adopter);
        return adopter;
    }

    private static String nearestNode(final Deque<Frame> open) {
        for (final Frame frame : open) {
            if (frame.nodeId() != null) {
                return frame.nodeId();
            }
        }
        return null;
    }

    private static Map<EStructureAttribute, String> attributes(final XMLStreamReader reader) {
        final Map<EStructureAttribute, String> attributes = new EnumMap<>(EStructureAttribute.class);
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            final String value = reader.getAttributeValue(i);
            EStructureAttribute.of(reader.getAttributeLocalName(i))
                    .ifPresent(attribute -> attributes.putIfAbsent(attribute, value));
        }
        return attributes;
    }

    private static int lineOf(final XMLStreamReader reader) {
        final Location location = reader.getLocation();
        return location == null ? -1 : location.getLineNumber();
    }

    private static void closeQuietly(final XMLStreamReader reader, final String sourceName) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException e) {
            log.warn("Unable to close XML reader for {}", sourceName, e);
        }
    }

    /**
     * An open element. {@code nodeId} is set only for sections and pages.
     */
    private record Frame(EStructureTag tag, String nodeId) {
    }
}
