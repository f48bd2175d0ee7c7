package eu.virtualparadox.helpindex.index.change;

import eu.virtualparadox.helpindex.index.metadata.IndexMetadata;
import eu.virtualparadox.helpindex.index.metadata.IndexMetadataStore;
import eu.virtualparadox.helpindex.util.Fingerprints;
import eu.virtualparadox.helpindex.util.LuceneConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Decides whether the persisted index must be regenerated.
 * <p>Checks, in order: force flag, presence of metadata, fingerprint of the structure document,
 * schema version, and presence of the index generation the metadata names. The check never
 * writes anything. A structure document that cannot be read counts as changed.</p>
 */
@Slf4j
@Component
public class ChangeDetector {

    private final String schemaVersion;

    public ChangeDetector() {
        this(LuceneConstants.SCHEMA_VERSION);
    }

    public ChangeDetector(final String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    /**
     * @param source       structure document
     * @param metadataFile persisted index metadata, may not exist
     * @param force        rebuild unconditionally
     * @return the decision with its reason
     */
    public RebuildDecision evaluate(final Path source, final Path metadataFile, final boolean force) {
        final Optional<IndexMetadata> stored = new IndexMetadataStore(metadataFile).read();
        final IndexMetadata previous = stored.orElse(null);

        if (force) {
            return new RebuildDecision(ERebuildReason.FORCED, previous);
        }
        if (previous == null) {
            return new RebuildDecision(ERebuildReason.MISSING_METADATA, null);
        }

        final String fingerprint;
        try {
            fingerprint = Fingerprints.sha256(source);
        } catch (IOException e) {
            log.warn("Cannot fingerprint structure document {}, treating it as changed", source, e);
            return new RebuildDecision(ERebuildReason.SOURCE_CHANGED, previous);
        }

        if (!fingerprint.equals(previous.sourceFingerprint())) {
            return new RebuildDecision(ERebuildReason.SOURCE_CHANGED, previous);
        }
        if (!schemaVersion.equals(previous.schemaVersion())) {
            return new RebuildDecision(ERebuildReason.SCHEMA_CHANGED, previous);
        }
        if (previous.generation() == null
                || !Files.isDirectory(metadataFile.toAbsolutePath().getParent().resolve(previous.generation()))) {
            return new RebuildDecision(ERebuildReason.INDEX_MISSING, previous);
        }
        return new RebuildDecision(ERebuildReason.UP_TO_DATE, previous);
    }

    public boolean needsRebuild(final Path source, final Path metadataFile, final boolean force) {
        return evaluate(source, metadataFile, force).rebuildRequired();
    }
}
