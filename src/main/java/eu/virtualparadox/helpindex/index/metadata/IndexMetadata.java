package eu.virtualparadox.helpindex.index.metadata;

import java.time.Instant;

/**
 * Persisted description of the last successful rebuild.
 *
 * @param sourceFingerprint SHA-256 of the structure document the index was built from
 * @param schemaVersion     fingerprint of the index layout at build time
 * @param builtAt           completion time of the build
 * @param documentCount     documents written to the index
 * @param pageCount         page nodes in the indexed tree
 * @param sectionCount      section nodes in the indexed tree
 * @param sourceSizeBytes   size of the structure document
 * @param generation        directory name, under the index path, holding the active index
 */
public record IndexMetadata(String sourceFingerprint,
                            String schemaVersion,
                            Instant builtAt,
                            int documentCount,
                            int pageCount,
                            int sectionCount,
                            long sourceSizeBytes,
                            String generation) {

}
