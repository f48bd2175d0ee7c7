package eu.virtualparadox.helpindex.index.build;

import lombok.extern.slf4j.Slf4j;

/**
 * Counts documents written during one rebuild and logs progress every {@code interval}
 * documents. Used by the single thread that feeds the index writer.
 */
@Slf4j
public final class BuildProgressTracker {

    private final int total;
    private final int interval;
    private int processed;

    public BuildProgressTracker(final int total, final int interval) {
        this.total = total;
        this.interval = Math.max(1, interval);
    }

    /**
     * Records one written document.
     *
     * @return {@code true} when this step crossed a reporting boundary
     */
    public boolean step() {
        processed++;
        if (processed % interval != 0) {
            return false;
        }
        final ProgressStatus status = getProgressStatus();
        log.info("Indexed {}/{} documents ({}%)", status.processed(), status.total(), status.percent());
        return true;
    }

    public ProgressStatus getProgressStatus() {
        final int percent = total == 0 ? 100 : (int) ((processed * 100L) / total);
        return new ProgressStatus(processed, total, percent);
    }
}
