package eu.virtualparadox.helpindex.catalog.model;

import java.time.Instant;

/**
 * @param documentCount   documents in the served index, 0 when none is open
 * @param builtAt         build time of the served index, {@code null} when none is open
 * @param nodeCount       nodes in the loaded tree
 * @param pageCount       page nodes in the loaded tree
 * @param sectionCount    section nodes in the loaded tree
 * @param helpIdCount     distinct stable identifiers
 * @param sourceSizeBytes size of the parsed structure document
 * @param indexPath       index directory
 * @param rebuilding      whether a rebuild is running
 */
public record IndexStatistics(int documentCount,
                              Instant builtAt,
                              int nodeCount,
                              int pageCount,
                              int sectionCount,
                              int helpIdCount,
                              long sourceSizeBytes,
                              String indexPath,
                              boolean rebuilding) {

}
