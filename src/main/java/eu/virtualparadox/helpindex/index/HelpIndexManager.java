package eu.virtualparadox.helpindex.index;

import eu.virtualparadox.helpindex.application.config.ApplicationConfig;
import eu.virtualparadox.helpindex.index.build.IndexBuilder;
import eu.virtualparadox.helpindex.index.change.ChangeDetector;
import eu.virtualparadox.helpindex.index.change.RebuildDecision;
import eu.virtualparadox.helpindex.index.metadata.IndexMetadata;
import eu.virtualparadox.helpindex.index.metadata.IndexMetadataStore;
import eu.virtualparadox.helpindex.tree.HelpTree;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static eu.virtualparadox.helpindex.util.LuceneConstants.SCHEMA_VERSION;

/**
 * Owns the on-disk index: decides on rebuilds, builds fresh generations and serves searchers.
 *
 * <h2>Generations</h2>
 * Every rebuild writes into a new {@code gen-<millis>} directory under the index path. The
 * metadata file names the active generation, so replacing it atomically is the commit point;
 * only then is the in-memory {@link SearcherManager} swapped. Queries running during a rebuild
 * keep using the previous generation. Generations other than the active one are deleted after
 * a swap and at startup.
 *
 * <p>At most one rebuild runs at a time; a concurrent request fails with
 * {@link RebuildInProgressException}.</p>
 */
@Service
@Slf4j
public class HelpIndexManager {

    static final String GENERATION_PREFIX = "gen-";
    private static final int ACQUIRE_ATTEMPTS = 3;

    private final ApplicationConfig props;
    private final HelpTree tree;
    private final IndexBuilder indexBuilder;
    private final ChangeDetector changeDetector;

    @Getter
    private final Path indexPath;
    private final IndexMetadataStore metadataStore;

    private final AtomicReference<ActiveIndex> active = new AtomicReference<>();
    private final AtomicBoolean rebuilding = new AtomicBoolean(false);

    public HelpIndexManager(final ApplicationConfig props,
                            final HelpTree tree,
                            final IndexBuilder indexBuilder,
                            final ChangeDetector changeDetector) {
        this.props = props;
        this.tree = tree;
        this.indexBuilder = indexBuilder;
        this.changeDetector = changeDetector;
        this.indexPath = props.resolveIndexPath();
        this.metadataStore = IndexMetadataStore.forIndex(indexPath);
    }

    /**
     * Opens the persisted index, rebuilding it first when the change check asks for it or the
     * persisted generation cannot be opened. When a required rebuild fails and the previous
     * generation is still on disk, that generation keeps being served and the rebuild is retried
     * on the next startup.
     *
     * @throws IndexBuildException if a required rebuild fails and no previous generation can be opened
     */
    @PostConstruct
    public void initialize() {
        final RebuildDecision decision = needsRebuild();
        log.info("Index at {}: {}", indexPath, decision.reason());

        if (decision.rebuildRequired()) {
            try {
                rebuild();
            } catch (IndexBuildException e) {
                serveAfterFailedRebuild(decision.previous(), e);
            }
            return;
        }

        final IndexMetadata metadata = decision.previous();
        try {
            active.set(open(metadata));
            log.info("Opened index generation {} ({} documents, built {})",
                    metadata.generation(), metadata.documentCount(), metadata.builtAt());
        } catch (IOException e) {
            log.warn("Unable to open index generation {}, rebuilding", metadata.generation(), e);
            rebuild();
            return;
        }
        pruneStaleGenerations();
    }

    private void serveAfterFailedRebuild(final IndexMetadata previous, final IndexBuildException failure) {
        if (previous == null || previous.generation() == null
                || !Files.isDirectory(indexPath.resolve(previous.generation()))) {
            throw failure;
        }
        try {
            active.set(open(previous));
        } catch (IOException e) {
            failure.addSuppressed(e);
            throw failure;
        }
        log.error("Index rebuild failed, serving previous generation {} ({} documents, built {})",
                previous.generation(), previous.documentCount(), previous.builtAt(), failure);
        pruneStaleGenerations();
    }

    public RebuildDecision needsRebuild() {
        return changeDetector.evaluate(props.getSourcePath(), metadataStore.getFile(), props.isForceRebuild());
    }

    /**
     * Builds a fresh generation from the tree and makes it the active index.
     *
     * <p>The tree is the one loaded at startup, and the recorded fingerprint is that tree's. A
     * structure document changed while running is picked up only after a restart, so
     * {@link #needsRebuild()} keeps reporting {@code SOURCE_CHANGED} after this call.</p>
     *
     * @return metadata of the new generation
     * @throws RebuildInProgressException if another rebuild is running
     * @throws IndexBuildException        if building or publishing fails
     */
    public IndexMetadata rebuild() {
        if (!rebuilding.compareAndSet(false, true)) {
            throw new RebuildInProgressException();
        }
        try {
            final String generation = nextGeneration();
            final Path target = indexPath.resolve(generation);
            final long started = System.currentTimeMillis();

            final int documents;
            try {
                documents = indexBuilder.build(tree, target);
            } catch (IOException | RuntimeException e) {
                deleteGeneration(target);
                throw new IndexBuildException("Index rebuild into " + target + " failed", e);
            }

            final IndexMetadata metadata = new IndexMetadata(
                    tree.getSourceFingerprint(),
                    SCHEMA_VERSION,
                    Instant.now(),
                    documents,
                    tree.pageCount(),
                    tree.sectionCount(),
                    tree.getSourceSizeBytes(),
                    generation);

            ActiveIndex fresh = null;
            try {
                fresh = open(metadata);
                metadataStore.write(metadata);
            } catch (IOException e) {
                closeQuietly(fresh);
                deleteGeneration(target);
                throw new IndexBuildException("Unable to publish index generation " + generation, e);
            }

            closeQuietly(active.getAndSet(fresh));
            pruneStaleGenerations();

            log.info("Rebuilt index generation {} with {} documents in {} ms",
                    generation, documents, System.currentTimeMillis() - started);
            return metadata;
        } finally {
            rebuilding.set(false);
        }
    }

    public boolean isRebuilding() {
        return rebuilding.get();
    }

    /**
     * @return metadata of the index currently served, empty before the first successful open
     */
    public Optional<IndexMetadata> currentMetadata() {
        final ActiveIndex current = active.get();
        return current == null ? Optional.empty() : Optional.of(current.metadata());
    }

    /**
     * Runs {@code callback} against a searcher of the active generation and releases it afterwards.
     *
     * @throws IllegalStateException if no index is open
     * @throws IOException           if the search fails
     */
    public <T> T withSearcher(final SearcherCallback<T> callback) throws IOException {
        for (int attempt = 1; ; attempt++) {
            final ActiveIndex current = active.get();
            if (current == null) {
                throw new IllegalStateException("No index is open");
            }

            final SearcherManager manager = current.searcherManager();
            final IndexSearcher searcher;
            try {
                searcher = manager.acquire();
            } catch (AlreadyClosedException e) {
                // swapped out between get() and acquire()
                if (attempt >= ACQUIRE_ATTEMPTS) {
                    throw e;
                }
                continue;
            }

            try {
                return callback.apply(searcher);
            } finally {
                manager.release(searcher);
            }
        }
    }

    @PreDestroy
    public void close() {
        closeQuietly(active.getAndSet(null));
    }

    private ActiveIndex open(final IndexMetadata metadata) throws IOException {
        final Directory directory = FSDirectory.open(indexPath.resolve(metadata.generation()));
        try {
            return new ActiveIndex(metadata, directory, new SearcherManager(directory, null));
        } catch (IOException | RuntimeException e) {
            directory.close();
            throw e;
        }
    }

    private String nextGeneration() {
        long stamp = System.currentTimeMillis();
        while (Files.exists(indexPath.resolve(GENERATION_PREFIX + stamp))) {
            stamp++;
        }
        return GENERATION_PREFIX + stamp;
    }

    private void pruneStaleGenerations() {
        final ActiveIndex current = active.get();
        final String keep = current == null ? null : current.metadata().generation();

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(indexPath, GENERATION_PREFIX + "*")) {
            for (final Path entry : entries) {
                if (Files.isDirectory(entry) && !entry.getFileName().toString().equals(keep)) {
                    deleteGeneration(entry);
                }
            }
        } catch (IOException e) {
            log.warn("Unable to list index generations in {}", indexPath, e);
        }
    }

    private void deleteGeneration(final Path generation) {
        try {
            FileSystemUtils.deleteRecursively(generation);
            log.debug("Deleted index generation {}", generation);
        } catch (IOException e) {
            log.warn("Unable to delete index generation {}, will retry later", generation, e);
        }
    }

    private static void closeQuietly(final ActiveIndex index) {
        if (index == null) {
            return;
        }
        try { index.searcherManager().close(); } catch (Exception e) {
            log.error("Unable to close SearcherManager of {}", index.metadata().generation(), e);
        }
        try { index.directory().close(); } catch (Exception e) {
            log.error("Unable to close Directory of {}", index.metadata().generation(), e);
        }
    }

    @FunctionalInterface
    public interface SearcherCallback<T> {
        T apply(IndexSearcher searcher) throws IOException;
    }

    private record ActiveIndex(IndexMetadata metadata, Directory directory, SearcherManager searcherManager) {
    }
}
