package com.heronix.progress.model.batch;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BatchProgressTest {

    @Test
    void percentIsNotReportedCompleteBeforeLastStudent() {
        BatchProgress progress = new BatchProgress(200);
        for (int i = 0; i < 199; i++) {
            progress.recordSuccess();
        }

        assertThat(progress.percentComplete()).isEqualTo(99);
        assertThat(progress.getSkipped()).isEqualTo(1);

        progress.recordFailure();

        assertThat(progress.percentComplete()).isEqualTo(100);
        assertThat(progress.getFailed()).isEqualTo(1);
    }

    @Test
    void percentRoundsDown() {
        BatchProgress progress = new BatchProgress(3);
        progress.recordSuccess();
        progress.recordSuccess();

        assertThat(progress.percentComplete()).isEqualTo(66);
    }

    @Test
    void emptyCohortIsComplete() {
        assertThat(new BatchProgress(0).percentComplete()).isEqualTo(100);
    }
}
