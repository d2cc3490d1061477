package com.fastextract.core.eta;

import com.fastextract.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EtaEstimatorTest {

    @Test
    void noSamples_isCalculatingAndUnreliable() {
        EtaEstimate e = new EtaEstimator().getEstimate(0, 10);

        assertThat(e.getFormatted()).isEqualTo("Calculating...");
        assertThat(e.isReliable()).isFalse();
    }

    @Test
    void belowMinSamples_isUnreliable() {
        EtaEstimator eta = new EtaEstimator(10, 3);
        eta.recordCompletion(0, 1000);
        eta.recordCompletion(0, 1000);

        EtaEstimate e = eta.getEstimate(2, 10);

        assertThat(e.isReliable()).isFalse();
        assertThat(e.getSamplesUsed()).isEqualTo(2);
        assertThat(e.getEstimatedMs()).isEqualTo(8000);
    }

    @Test
    void average_timesRemaining() {
        EtaEstimator eta = new EtaEstimator(10, 3);
        eta.recordCompletion(0, 1000);
        eta.recordCompletion(0, 2000);
        eta.recordCompletion(0, 3000);

        EtaEstimate e = eta.getEstimate(3, 63);

        assertThat(e.isReliable()).isTrue();
        assertThat(e.getAverageTaskMs()).isEqualTo(2000);
        assertThat(e.getEstimatedMs()).isEqualTo(120_000);
        assertThat(e.getFormatted()).isEqualTo("2m");
    }

    @Test
    void window_dropsOldestSamples() {
        EtaEstimator eta = new EtaEstimator(2, 1);
        eta.recordCompletion(0, 10_000);
        eta.recordCompletion(0, 1000);
        eta.recordCompletion(0, 1000);

        assertThat(eta.sampleCount()).isEqualTo(2);
        assertThat(eta.getEstimate(3, 4).getAverageTaskMs()).isEqualTo(1000);
    }

    @Test
    void nonPositiveDurations_areIgnored() {
        EtaEstimator eta = new EtaEstimator();
        eta.recordCompletion(500, 500);
        eta.recordCompletion(500, 100);

        assertThat(eta.sampleCount()).isZero();
    }

    @Test
    void complete_reportsZero() {
        EtaEstimator eta = new EtaEstimator();
        eta.recordCompletion(0, 400);

        EtaEstimate e = eta.getEstimate(5, 5);

        assertThat(e.getEstimatedMs()).isZero();
        assertThat(e.getFormatted()).isEqualTo("Complete");
    }

    @Test
    void reset_clearsWindow() {
        EtaEstimator eta = new EtaEstimator();
        eta.recordCompletion(0, 400);
        eta.reset();

        assertThat(eta.sampleCount()).isZero();
    }

    @Test
    void format_coversRanges() {
        assertThat(EtaEstimator.format(500)).isEqualTo("< 1s");
        assertThat(EtaEstimator.format(45_000)).isEqualTo("45s");
        assertThat(EtaEstimator.format(150_000)).isEqualTo("2m 30s");
        assertThat(EtaEstimator.format(3_600_000)).isEqualTo("1h");
        assertThat(EtaEstimator.format(5_400_000)).isEqualTo("1h 30m");
        assertThat(EtaEstimator.format(90_000_000)).isEqualTo("> 24h");
    }

    @Test
    void invalidConfiguration_isRejected() {
        assertThatThrownBy(() -> new EtaEstimator(0, 1)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new EtaEstimator(5, 0)).isInstanceOf(InvalidConfigurationException.class);
    }
}
