package com.scholary.songscraper.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.songscraper.error.ConflictException;
import com.scholary.songscraper.error.InvalidStateException;
import com.scholary.songscraper.error.NotFoundException;
import com.scholary.songscraper.error.ValidationException;
import com.scholary.songscraper.job.SongRequest;
import com.scholary.songscraper.service.JobManager;
import com.scholary.songscraper.service.SongListValidator;
import com.scholary.songscraper.support.MutableClock;
import com.scholary.songscraper.support.TestProperties;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionManagerTest {

  private static final long USER = 11L;
  private static final String URL = "https://songs.test/praise-night-20-with-pastor-chris/song";

  @Mock private JobManager jobManager;

  private SessionManager sessionManager;

  @BeforeEach
  void setUp() {
    MutableClock clock = new MutableClock(Instant.parse("2026-05-01T09:00:00Z"));
    sessionManager =
        new SessionManager(
            new SessionRepository(TestProperties.scraper(), clock),
            new SongListValidator(TestProperties.scraper()),
            new EventLabelExtractor(),
            jobManager,
            clock);
  }

  @Test
  void fullFlow_shouldCollectFieldsAndQueueSong() {
    SessionSnapshot started = sessionManager.start(USER);
    assertThat(started.state()).isEqualTo(SessionState.AWAITING_TITLE);
    assertThat(started.expectedField()).isEqualTo("title");

    sessionManager.submitField(USER, " Great God ");
    sessionManager.submitField(USER, "Choir");
    SessionSnapshot awaitingConfirmation = sessionManager.submitField(USER, URL);

    assertThat(awaitingConfirmation.state()).isEqualTo(SessionState.AWAITING_CONFIRMATION);
    assertThat(awaitingConfirmation.draft())
        .isEqualTo(new SongDraft("Great God", "Choir", URL, "Praise Night 20 with Pastor Chris"));

    SessionSnapshot confirmed = sessionManager.confirm(USER);

    assertThat(confirmed.state()).isEqualTo(SessionState.AWAITING_TITLE);
    assertThat(confirmed.draft()).isEqualTo(SongDraft.EMPTY);
    assertThat(sessionManager.queue(USER))
        .containsExactly(
            new SongRequest("Great God", "Choir", URL, "Praise Night 20 with Pastor Chris"));
  }

  @Test
  void submitField_inConfirmation_shouldOverrideEvent() {
    walkToConfirmation("https://songs.test/plain-song");
    assertThat(sessionManager.snapshot(USER).draft().event()).isNull();

    SessionSnapshot snapshot = sessionManager.submitField(USER, "Easter Service");

    assertThat(snapshot.state()).isEqualTo(SessionState.AWAITING_CONFIRMATION);
    assertThat(snapshot.draft().event()).isEqualTo("Easter Service");
  }

  @Test
  void submitField_shouldRejectBadValuesWithoutMoving() {
    sessionManager.start(USER);
    sessionManager.submitField(USER, "Title");
    sessionManager.submitField(USER, "Artist");

    assertThatThrownBy(() -> sessionManager.submitField(USER, "not a url"))
        .isInstanceOf(ValidationException.class);
    assertThat(sessionManager.snapshot(USER).state()).isEqualTo(SessionState.AWAITING_URL);
  }

  @Test
  void start_shouldConflictWhileActive() {
    sessionManager.start(USER);

    assertThatThrownBy(() -> sessionManager.start(USER)).isInstanceOf(ConflictException.class);
  }

  @Test
  void operations_withoutActiveSession_shouldBeRejected() {
    assertThatThrownBy(() -> sessionManager.submitField(USER, "x"))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> sessionManager.cancel(USER)).isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> sessionManager.snapshot(USER))
        .isInstanceOf(NotFoundException.class);
    assertThat(sessionManager.queue(USER)).isEmpty();
    sessionManager.clear(USER);
  }

  @Test
  void confirmAndFinish_shouldRequireTheirStates() {
    sessionManager.start(USER);
    assertThatThrownBy(() -> sessionManager.confirm(USER))
        .isInstanceOf(InvalidStateException.class);

    sessionManager.submitField(USER, "Title");
    assertThatThrownBy(() -> sessionManager.finish(USER))
        .isInstanceOf(InvalidStateException.class)
        .hasMessage("Cannot finish in state AWAITING_ARTIST (expected AWAITING_TITLE)");
  }

  @Test
  void cancelAndFinish_shouldKeepTheQueue() {
    walkToConfirmation(URL);
    sessionManager.confirm(USER);
    sessionManager.submitField(USER, "Half entered");

    SessionSnapshot cancelled = sessionManager.cancel(USER);

    assertThat(cancelled.state()).isEqualTo(SessionState.IDLE);
    assertThat(cancelled.queue()).hasSize(1);
    assertThatThrownBy(() -> sessionManager.cancel(USER))
        .isInstanceOf(InvalidStateException.class);

    sessionManager.start(USER);
    SessionSnapshot finished = sessionManager.finish(USER);
    assertThat(finished.state()).isEqualTo(SessionState.IDLE);
    assertThat(sessionManager.queue(USER)).hasSize(1);
  }

  @Test
  void clear_shouldEmptyQueueAndReturnToIdle() {
    walkToConfirmation(URL);
    sessionManager.confirm(USER);

    sessionManager.clear(USER);

    SessionSnapshot snapshot = sessionManager.snapshot(USER);
    assertThat(snapshot.queue()).isEmpty();
    assertThat(snapshot.state()).isEqualTo(SessionState.IDLE);
  }

  @Test
  void submitQueue_shouldCreateJobAndClearQueue() {
    walkToConfirmation(URL);
    sessionManager.confirm(USER);
    when(jobManager.submit(eq(USER), anyList())).thenReturn("11_20260501_090000_abcdef01");

    String jobId = sessionManager.submitQueue(USER);

    assertThat(jobId).isEqualTo("11_20260501_090000_abcdef01");
    verify(jobManager)
        .submit(
            USER,
            List.of(
                new SongRequest("Great God", "Choir", URL, "Praise Night 20 with Pastor Chris")));
    assertThat(sessionManager.queue(USER)).isEmpty();
  }

  @Test
  void submitQueue_shouldKeepQueueWhenJobIsRejected() {
    walkToConfirmation(URL);
    sessionManager.confirm(USER);
    when(jobManager.submit(eq(USER), anyList()))
        .thenThrow(new ValidationException("Too many songs"));

    assertThatThrownBy(() -> sessionManager.submitQueue(USER))
        .isInstanceOf(ValidationException.class);
    assertThat(sessionManager.queue(USER)).hasSize(1);
  }

  @Test
  void submitQueue_withEmptyQueue_shouldBeRejected() {
    assertThatThrownBy(() -> sessionManager.submitQueue(USER))
        .isInstanceOf(ValidationException.class);
    sessionManager.start(USER);
    assertThatThrownBy(() -> sessionManager.submitQueue(USER))
        .isInstanceOf(ValidationException.class)
        .hasMessage("No songs queued for user 11");
    verify(jobManager, never()).submit(anyLong(), anyList());
  }

  private void walkToConfirmation(String url) {
    sessionManager.start(USER);
    sessionManager.submitField(USER, "Great God");
    sessionManager.submitField(USER, "Choir");
    sessionManager.submitField(USER, url);
  }
}
