package eu.virtualparadox.helpindex.ingest.extractor;

import eu.virtualparadox.helpindex.application.config.ApplicationConfig;
import eu.virtualparadox.helpindex.tree.model.HelpNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves a node's content file under the corpus root and extracts its plain text on first
 * access. The result is cached on the node for the lifetime of the process.
 * <p>A node without a file, a file outside the root, a missing file or an unreadable one all
 * yield empty text; failures are logged and never propagate.</p>
 */
@Service
@Slf4j
public class ContentExtractor {

    private final TextExtractor textExtractor;
    private final Path root;

    public ContentExtractor(final TextExtractor textExtractor, final ApplicationConfig props) {
        this.textExtractor = textExtractor;
        this.root = props.getRoot().toAbsolutePath().normalize();
    }

    /**
     * @param node node to read
     * @return extracted plain text, empty when unavailable
     */
    public String extractText(final HelpNode node) {
        final Optional<String> cached = node.cachedText();
        if (cached.isPresent()) {
            return cached.get();
        }

        final String text = resolve(node).map(path -> read(node, path)).orElse("");
        node.cacheText(text);
        return text;
    }

    /**
     * Maps the node's file reference to a path under the root. Backslash separators and
     * fragment suffixes ({@code page.html#anchor}) are tolerated.
     */
    public Optional<Path> resolve(final HelpNode node) {
        if (!node.hasFile()) {
            return Optional.empty();
        }

        String reference = node.getFile().replace('\\', '/');
        final int fragment = reference.indexOf('#');
        if (fragment >= 0) {
            reference = reference.substring(0, fragment);
        }
        if (reference.isBlank()) {
            return Optional.empty();
        }

        try {
            final Path path = root.resolve(reference).normalize();
            if (!path.startsWith(root)) {
                log.warn("Content file of {} escapes the corpus root: {}", node.getId(), node.getFile());
                return Optional.empty();
            }
            return Optional.of(path);
        } catch (InvalidPathException e) {
            log.warn("Invalid content file reference on {}: {}", node.getId(), node.getFile());
            return Optional.empty();
        }
    }

    private String read(final HelpNode node, final Path path) {
        if (!Files.isRegularFile(path)) {
            log.warn("Content file of {} not found: {}", node.getId(), path);
            return "";
        }
        try {
            return textExtractor.extractText(path);
        } catch (Exception e) {
            log.warn("Failed to extract text of {} from {}", node.getId(), path, e);
            return "";
        }
    }
}
