package eu.virtualparadox.helpindex.index.build;

/**
 * Progress status of a rebuild.
 *
 * @param processed documents written so far
 * @param total     documents expected
 * @param percent   overall progress percentage (0-100)
 */
public record ProgressStatus(int processed, int total, int percent) {

}
