package com.scholary.songscraper.progress;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.songscraper.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProgressTrackerTest {

  private MutableClock clock;
  private ProgressTracker tracker;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    tracker = new ProgressTracker(Duration.ofHours(1), clock);
  }

  @Test
  void record_shouldAdvanceOpenedPhase() {
    tracker.open("job-1", Phase.LYRICS, 2);
    clock.advance(Duration.ofSeconds(5));

    Optional<PhaseProgressView> view =
        tracker.record("job-1", Phase.LYRICS, Outcome.SUCCESS, "Song A");

    assertThat(view).isPresent();
    assertThat(view.get().current()).isEqualTo(1);
    assertThat(view.get().percentage()).isEqualTo(50.0);
    assertThat(view.get().updatedAt()).isEqualTo(clock.instant());
  }

  @Test
  void record_shouldIgnoreUnknownJobOrPhase() {
    tracker.open("job-1", Phase.LYRICS, 2);

    assertThat(tracker.record("job-2", Phase.LYRICS, Outcome.SUCCESS, "x")).isEmpty();
    assertThat(tracker.record("job-1", Phase.AUDIO, Outcome.SUCCESS, "x")).isEmpty();
  }

  @Test
  void finalizePhase_shouldMakeLaterUpdatesNoOps() {
    tracker.open("job-1", Phase.AUDIO, 3);
    tracker.record("job-1", Phase.AUDIO, Outcome.SUCCESS, "a");

    assertThat(tracker.finalizePhase("job-1", Phase.AUDIO, PhaseStatus.FAILED, "Job cancelled"))
        .isPresent();
    assertThat(tracker.record("job-1", Phase.AUDIO, Outcome.SUCCESS, "b")).isEmpty();
    assertThat(tracker.finalizePhase("job-1", Phase.AUDIO, PhaseStatus.COMPLETED, null)).isEmpty();

    PhaseProgressView view = tracker.phase("job-1", Phase.AUDIO).orElseThrow();
    assertThat(view.current()).isEqualTo(1);
    assertThat(view.status()).isEqualTo(PhaseStatus.FAILED);
  }

  @Test
  void open_shouldKeepExistingRecord() {
    tracker.open("job-1", Phase.LYRICS, 2);
    tracker.record("job-1", Phase.LYRICS, Outcome.SUCCESS, "a");

    PhaseProgressView reopened = tracker.open("job-1", Phase.LYRICS, 10);

    assertThat(reopened.total()).isEqualTo(2);
    assertThat(reopened.current()).isEqualTo(1);
  }

  @Test
  void phases_shouldListInPhaseOrder() {
    tracker.open("job-1", Phase.ARCHIVING, 1);
    tracker.open("job-1", Phase.LYRICS, 1);
    tracker.open("job-1", Phase.AUDIO, 1);

    assertThat(tracker.phases("job-1"))
        .extracting(PhaseProgressView::phase)
        .containsExactly(Phase.LYRICS, Phase.AUDIO, Phase.ARCHIVING);
    assertThat(tracker.phases("unknown")).isEmpty();
  }

  @Test
  void percentage_shouldBeNonDecreasingUnderRandomUpdates() {
    Random random = new Random(42);
    int total = 25;
    tracker.open("job-1", Phase.LYRICS, total);

    List<Double> observed = new ArrayList<>();
    for (int i = 0; i < 60; i++) {
      Outcome outcome = random.nextBoolean() ? Outcome.SUCCESS : Outcome.FAILURE;
      if (i == 40) {
        tracker.finalizePhase("job-1", Phase.LYRICS, PhaseStatus.COMPLETED, null);
      }
      tracker.record("job-1", Phase.LYRICS, outcome, "song-" + i);
      observed.add(tracker.phase("job-1", Phase.LYRICS).orElseThrow().percentage());
    }

    for (int i = 1; i < observed.size(); i++) {
      assertThat(observed.get(i)).isGreaterThanOrEqualTo(observed.get(i - 1));
    }
    assertThat(observed).allSatisfy(p -> assertThat(p).isBetween(0.0, 100.0));
    assertThat(tracker.phase("job-1", Phase.LYRICS).orElseThrow().current()).isEqualTo(total);
  }
}
