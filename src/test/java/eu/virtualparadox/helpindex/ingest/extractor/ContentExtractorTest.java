package eu.virtualparadox.helpindex.ingest.extractor;

import eu.virtualparadox.helpindex.HelpCorpusFixture;
import eu.virtualparadox.helpindex.application.config.ApplicationConfig;
import eu.virtualparadox.helpindex.ingest.cleaner.TextCleaner;
import eu.virtualparadox.helpindex.tree.model.ENodeKind;
import eu.virtualparadox.helpindex.tree.model.HelpNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ContentExtractorTest {

    @TempDir
    Path dir;

    private Path root;
    private ApplicationConfig props;

    @BeforeEach
    void setUp() throws IOException {
        root = dir.resolve("help");
        HelpCorpusFixture.writeCorpus(root, HelpCorpusFixture.LONG_TAGS);
        props = new ApplicationConfig();
        props.setRoot(root);
    }

    private static HelpNode page(final String file) {
        return new HelpNode("p", "Page", file, ENodeKind.PAGE, List.of(), null, List.of());
    }

    @Test
    @DisplayName("Page text is read from the file under the root")
    void extractsPageText() {
        final ContentExtractor extractor = new ContentExtractor(new HtmlTextExtractor(new TextCleaner()), props);

        assertThat(extractor.extractText(page("hardware/x20di9371.html")))
                .isEqualTo("X20DI9371 Digital input module with 12 channels.");
    }

    @Test
    @DisplayName("Backslash separators and fragments are tolerated")
    void toleratesWindowsPathsAndFragments() {
        final ContentExtractor extractor = new ContentExtractor(new HtmlTextExtractor(new TextCleaner()), props);

        assertThat(extractor.extractText(page("motion\\mapp_motion\\mc_br_moveabsolute.html#params")))
                .contains("Moves axis to absolute position.");
    }

    @Test
    @DisplayName("Second access is served from the node cache")
    void cachesExtractedText() throws IOException {
        final AtomicInteger reads = new AtomicInteger();
        final HtmlTextExtractor html = new HtmlTextExtractor(new TextCleaner());
        final ContentExtractor extractor = new ContentExtractor(path -> {
            reads.incrementAndGet();
            return html.extractText(path);
        }, props);
        final HelpNode node = page("hardware/x20di9371.html");

        final String first = extractor.extractText(node);
        Files.delete(root.resolve("hardware/x20di9371.html"));
        final String second = extractor.extractText(node);

        assertThat(second).isEqualTo(first).isNotEmpty();
        assertThat(reads).hasValue(1);
    }

    @Test
    @DisplayName("Missing file, missing reference and failing extraction yield empty text")
    void failuresYieldEmptyText() {
        final ContentExtractor extractor = new ContentExtractor(new HtmlTextExtractor(new TextCleaner()), props);
        final ContentExtractor failing = new ContentExtractor(path -> {
            throw new IOException("corrupt");
        }, props);

        assertThat(extractor.extractText(page("missing.html"))).isEmpty();
        assertThat(extractor.extractText(page(null))).isEmpty();
        assertThat(failing.extractText(page("index.html"))).isEmpty();
    }

    @Test
    @DisplayName("File reference escaping the root is refused")
    void refusesPathsOutsideRoot() throws IOException {
        Files.writeString(dir.resolve("secret.html"), "<html><body>secret</body></html>");
        final ContentExtractor extractor = new ContentExtractor(new HtmlTextExtractor(new TextCleaner()), props);
        final HelpNode escaping = page("../secret.html");

        assertThat(extractor.resolve(escaping)).isEmpty();
        assertThat(extractor.extractText(escaping)).isEmpty();
    }
}
