package com.scholary.songscraper.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class PhaseProgressTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  @Test
  void record_shouldCountSuccessesAndFailures() {
    PhaseProgress progress = new PhaseProgress(Phase.LYRICS, 4, T0);

    progress.record(Outcome.SUCCESS, "one", T0);
    progress.record(Outcome.FAILURE, "two", T0);
    progress.record(Outcome.SUCCESS, "three", T0);

    PhaseProgressView view = progress.view();
    assertThat(view.current()).isEqualTo(3);
    assertThat(view.succeeded()).isEqualTo(2);
    assertThat(view.failed()).isEqualTo(1);
    assertThat(view.percentage()).isEqualTo(75.0);
    assertThat(view.currentItem()).isEqualTo("three");
    assertThat(view.status()).isEqualTo(PhaseStatus.RUNNING);
  }

  @Test
  void record_shouldNeverExceedTotal() {
    PhaseProgress progress = new PhaseProgress(Phase.AUDIO, 2, T0);

    assertThat(progress.record(Outcome.SUCCESS, "a", T0)).isTrue();
    assertThat(progress.record(Outcome.SUCCESS, "b", T0)).isTrue();
    assertThat(progress.record(Outcome.SUCCESS, "c", T0)).isFalse();

    assertThat(progress.view().current()).isEqualTo(2);
    assertThat(progress.view().percentage()).isEqualTo(100.0);
  }

  @Test
  void finish_shouldFreezePhase() {
    PhaseProgress progress = new PhaseProgress(Phase.LYRICS, 3, T0);
    progress.record(Outcome.SUCCESS, "a", T0);

    assertThat(progress.finish(PhaseStatus.FAILED, "Job cancelled", T0)).isTrue();
    assertThat(progress.record(Outcome.SUCCESS, "b", T0)).isFalse();
    assertThat(progress.finish(PhaseStatus.COMPLETED, null, T0)).isFalse();

    PhaseProgressView view = progress.view();
    assertThat(view.current()).isEqualTo(1);
    assertThat(view.status()).isEqualTo(PhaseStatus.FAILED);
    assertThat(view.errorDetail()).isEqualTo("Job cancelled");
  }

  @Test
  void finish_shouldRejectRunningStatus() {
    PhaseProgress progress = new PhaseProgress(Phase.LYRICS, 1, T0);

    assertThatThrownBy(() -> progress.finish(PhaseStatus.RUNNING, null, T0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void percentage_shouldRoundAndHandleEmptyPhase() {
    assertThat(PhaseProgress.percentage(1, 3)).isEqualTo(33.33);
    assertThat(PhaseProgress.percentage(2, 3)).isEqualTo(66.67);
    assertThat(PhaseProgress.percentage(0, 0)).isEqualTo(0.0);
    assertThat(PhaseProgress.percentage(5, 4)).isEqualTo(100.0);
  }
}
