package eu.virtualparadox.helpindex.index.build;

import eu.virtualparadox.helpindex.application.config.ApplicationConfig;
import eu.virtualparadox.helpindex.application.executor.ExtractionExecutor;
import eu.virtualparadox.helpindex.ingest.extractor.ContentExtractor;
import eu.virtualparadox.helpindex.tree.HelpTree;
import eu.virtualparadox.helpindex.tree.ancestry.AncestryResolver;
import eu.virtualparadox.helpindex.tree.model.HelpNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static eu.virtualparadox.helpindex.util.LuceneConstants.*;

/**
 * Writes one complete index generation from a {@link HelpTree}.
 * <p>
 * Steps:
 * <ol>
 *   <li>Walk all nodes in document order, in batches of {@code batchSize}</li>
 *   <li>Extract page text in parallel on the {@link ExtractionExecutor}; sections get title-only entries</li>
 *   <li>Add the batch to the index writer in document order and commit it</li>
 * </ol>
 * The target directory is always fresh; callers swap it in only after this returns.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code pageId} – {@link StringField}: node identity</li>
 *   <li>{@code title}, {@code body} – {@link TextField}: searchable, stored for display</li>
 *   <li>{@code breadcrumb}, {@code file} – {@link StoredField}: display only</li>
 *   <li>{@code category}, {@code helpId}, {@code kind} – {@link StringField}: exact-match filters</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndexBuilder {

    private final ContentExtractor contentExtractor;
    private final ExtractionExecutor extractionExecutor;
    private final Analyzer analyzer;
    private final ApplicationConfig props;

    /**
     * Builds a new index into {@code target}.
     *
     * @param tree   source tree
     * @param target empty or absent directory receiving the index
     * @return number of documents written
     * @throws IOException if the index cannot be written
     */
    public int build(final HelpTree tree, final Path target) throws IOException {
        Files.createDirectories(target);

        final AncestryResolver ancestry = new AncestryResolver(tree);
        final List<HelpNode> nodes = new ArrayList<>(tree.nodes());
        final int batchSize = Math.max(1, props.getBatchSize());
        final BuildProgressTracker progress = new BuildProgressTracker(nodes.size(), props.getProgressInterval());

        log.info("Building index of {} nodes into {}", nodes.size(), target);

        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE);

        try (Directory directory = FSDirectory.open(target);
             IndexWriter writer = new IndexWriter(directory, cfg)) {

            for (int from = 0; from < nodes.size(); from += batchSize) {
                final List<HelpNode> batch = nodes.subList(from, Math.min(nodes.size(), from + batchSize));

                // 1) extract in parallel
                final List<CompletableFuture<String>> bodies = new ArrayList<>(batch.size());
                for (final HelpNode node : batch) {
                    bodies.add(node.isSection()
                            ? CompletableFuture.completedFuture("")
                            : extractionExecutor.submitCompletable(() -> contentExtractor.extractText(node)));
                }

                // 2) write in document order
                for (int i = 0; i < batch.size(); i++) {
                    writer.addDocument(buildLuceneDocument(batch.get(i), await(bodies.get(i)), ancestry));
                    progress.step();
                }

                // 3) one commit per batch
                writer.commit();
            }

            writer.commit();
            final int count = writer.getDocStats().numDocs;
            log.info("Index build finished: {} documents", count);
            return count;
        }
    }

    private Document buildLuceneDocument(final HelpNode node, final String body, final AncestryResolver ancestry) {
        final Document d = new Document();

        d.add(new StringField(FIELD_PAGE_ID, node.getId(), Field.Store.YES));
        d.add(new StringField(FIELD_KIND, node.getKind().name(), Field.Store.YES));

        d.add(new TextField(FIELD_TITLE, node.getTitle(), Field.Store.YES));
        d.add(new TextField(FIELD_BODY, body, Field.Store.YES));

        d.add(new StoredField(FIELD_BREADCRUMB, ancestry.breadcrumbString(node.getId())));
        ancestry.category(node.getId())
                .filter(category -> !category.isEmpty())
                .ifPresent(category -> d.add(new StringField(FIELD_CATEGORY, category, Field.Store.YES)));

        for (final String helpId : node.getHelpIds()) {
            d.add(new StringField(FIELD_HELP_ID, helpId, Field.Store.YES));
        }
        if (node.hasFile()) {
            d.add(new StoredField(FIELD_FILE, node.getFile()));
        }
        return d;
    }

    private static String await(final CompletableFuture<String> body) throws IOException {
        try {
            return body.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Index build interrupted");
        } catch (ExecutionException e) {
            throw new IOException("Text extraction failed", e.getCause());
        }
    }
}
