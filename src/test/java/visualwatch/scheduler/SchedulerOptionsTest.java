package visualwatch.scheduler;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.*;

public class SchedulerOptionsTest {

    @Test(description = "Only the interval is required; other options default to no jitter and no backoff")
    public void defaults() {
        SchedulerOptions opts = SchedulerOptions.fixed(1_000);

        assertThat(opts.intervalMs()).isEqualTo(1_000);
        assertThat(opts.maxJitterMs()).isZero();
        assertThat(opts.backoffMultiplier()).isEqualTo(1.0);
        assertThat(opts.maxBackoffMs()).isEqualTo(1_000);
        assertThat(opts.backoffFor(5)).isEqualTo(1_000);
    }

    @Test(description = "Backoff grows geometrically and is capped at maxBackoff")
    public void backoffFor_growsAndCaps() {
        SchedulerOptions opts = SchedulerOptions.builder(1_000)
                .backoffMultiplier(2.0)
                .maxBackoffMs(10_000)
                .build();

        assertThat(opts.backoffFor(0)).isEqualTo(1_000);
        assertThat(opts.backoffFor(1)).isEqualTo(2_000);
        assertThat(opts.backoffFor(2)).isEqualTo(4_000);
        assertThat(opts.backoffFor(3)).isEqualTo(8_000);
        assertThat(opts.backoffFor(4)).isEqualTo(10_000);
        assertThat(opts.backoffFor(40)).isEqualTo(10_000);
    }

    @Test
    public void invalidValues_rejected() {
        assertThatThrownBy(() -> SchedulerOptions.builder(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchedulerOptions.builder(100).maxJitterMs(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchedulerOptions.builder(100).backoffMultiplier(0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchedulerOptions.builder(100).maxBackoffMs(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
