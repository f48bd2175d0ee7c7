package eu.virtualparadox.helpindex.index.build;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BuildProgressTrackerTest {

    @Test
    void reportsAtEveryInterval() {
        final BuildProgressTracker tracker = new BuildProgressTracker(10, 3);

        int reports = 0;
        for (int i = 0; i < 10; i++) {
            if (tracker.step()) {
                reports++;
            }
        }

        assertThat(reports).isEqualTo(3);
        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(10, 10, 100));
    }

    @Test
    void percentIsTruncated() {
        final BuildProgressTracker tracker = new BuildProgressTracker(3, 100);
        tracker.step();

        assertThat(tracker.getProgressStatus().percent()).isEqualTo(33);
    }

    @Test
    void emptyBuildIsComplete() {
        assertThat(new BuildProgressTracker(0, 0).getProgressStatus().percent()).isEqualTo(100);
    }
}
