package eu.virtualparadox.helpindex.index.change;

import eu.virtualparadox.helpindex.index.metadata.IndexMetadata;

import java.util.Optional;

/**
 * Outcome of a change check.
 *
 * @param reason   why a rebuild is or is not needed
 * @param previous metadata of the current index, {@code null} when none was read
 */
public record RebuildDecision(ERebuildReason reason, IndexMetadata previous) {

    public boolean rebuildRequired() {
        return reason != ERebuildReason.UP_TO_DATE;
    }

    public Optional<IndexMetadata> previousMetadata() {
        return Optional.ofNullable(previous);
    }
}
